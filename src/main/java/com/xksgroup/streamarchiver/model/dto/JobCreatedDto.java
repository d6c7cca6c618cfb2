package com.xksgroup.streamarchiver.model.dto;

import com.xksgroup.streamarchiver.model.Job.JobStatus;

public record JobCreatedDto(String id, String videoId, JobStatus status) {
}
