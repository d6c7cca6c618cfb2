package com.xksgroup.streamarchiver.model.Job;

public record JobStatusSummary(
        String id,
        long videoSeq,
        long audioSeq,
        long maxSeq,
        long totalDownloaded,
        JobStatus status
) {}
