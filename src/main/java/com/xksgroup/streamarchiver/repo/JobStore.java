package com.xksgroup.streamarchiver.repo;

import com.xksgroup.streamarchiver.model.Job.JobSnapshot;

import java.util.List;

/**
 * Durable storage of job snapshots, keyed by job id.
 */
public interface JobStore {

    /**
     * Inserts or replaces the stored snapshot for {@code snapshot.getId()}.
     */
    void save(JobSnapshot snapshot);

    /**
     * Every stored snapshot that could be decoded. Undecodable records are skipped.
     */
    List<JobSnapshot> loadAll();
}
