package com.xksgroup.streamarchiver.model.Job;

public enum HealthCheckResult {
    OK,
    HEALTHCHECK_FAILURE,          // Upstream could not be queried
    VIDEO_UNAVAILABLE,            // Upstream requires login (privated / removed)
    STREAM_LENGTH_DIFFERS,        // Archived duration does not match upstream
    STREAM_LENGTH_INDETERMINATE   // Archived duration is ambiguous (multiple manifests)
}
