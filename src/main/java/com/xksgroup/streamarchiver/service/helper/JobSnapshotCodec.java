package com.xksgroup.streamarchiver.service.helper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON form of a job snapshot as stored in the {@code jobs} collection.
 */
@Component
@RequiredArgsConstructor
public class JobSnapshotCodec {

    private final ObjectMapper objectMapper;

    public String encode(JobSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize job " + snapshot.getId(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the payload is not a valid snapshot
     */
    public JobSnapshot decode(String payload) {
        try {
            return objectMapper.readValue(payload, JobSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not decode stored job: " + e.getOriginalMessage(), e);
        }
    }
}
