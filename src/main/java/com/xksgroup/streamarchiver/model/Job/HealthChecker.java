package com.xksgroup.streamarchiver.model.Job;

/**
 * Verifies that the archived copy of a job still matches its upstream source.
 */
@FunctionalInterface
public interface HealthChecker {

    HealthCheckResult check(JobSnapshot snapshot) throws InterruptedException;
}
