package com.xksgroup.streamarchiver.repo;

import com.xksgroup.streamarchiver.model.record.JobRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JobRecordRepository extends MongoRepository<JobRecord, String> {
}
