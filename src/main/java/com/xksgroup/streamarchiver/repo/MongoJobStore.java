package com.xksgroup.streamarchiver.repo;

import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import com.xksgroup.streamarchiver.model.record.JobRecord;
import com.xksgroup.streamarchiver.service.helper.JobSnapshotCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class MongoJobStore implements JobStore {

    private final JobRecordRepository repository;
    private final JobSnapshotCodec codec;
    private final Clock clock;

    @Override
    public void save(JobSnapshot snapshot) {
        repository.save(JobRecord.builder()
                .id(snapshot.getId())
                .payload(codec.encode(snapshot))
                .updatedAt(clock.instant())
                .build());
        log.debug("Persisted job {} ({})", snapshot.getId(), snapshot.getStatus());
    }

    @Override
    public List<JobSnapshot> loadAll() {
        List<JobSnapshot> snapshots = new ArrayList<>();
        for (JobRecord record : repository.findAll()) {
            try {
                snapshots.add(codec.decode(record.getPayload()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping stored job {}: {}", record.getId(), e.getMessage());
            }
        }
        return snapshots;
    }
}
