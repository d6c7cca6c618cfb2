package com.xksgroup.streamarchiver.service;

import com.xksgroup.streamarchiver.model.Job.DownloadJob;
import com.xksgroup.streamarchiver.model.Job.JobHooks;
import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import com.xksgroup.streamarchiver.model.Job.JobStatus;
import com.xksgroup.streamarchiver.repo.JobStore;
import com.xksgroup.streamarchiver.service.health.HealthCheckScheduler;
import com.xksgroup.streamarchiver.service.notification.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Side effects of job state changes: notifications, live updates, persistence and health checks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobLifecycleHooks implements JobHooks {

    private final Notifier notifier;
    private final JobBroadcaster broadcaster;
    private final JobStore jobStore;
    private final HealthCheckScheduler healthCheckScheduler;

    @Override
    public void statusChanged(DownloadJob job) {
        JobSnapshot snapshot = job.snapshot();
        JobStatus status = snapshot.getStatus();
        try {
            notifier.notify(
                    "Archive status: " + status.displayName(),
                    snapshot.getTitle() + " from " + snapshot.getAuthor() + " @ https://youtu.be/" + snapshot.getVideoId(),
                    status.notificationTag());
        } catch (RuntimeException e) {
            log.warn("Dropped status notification for job {}: {}", job.getId(), e.getMessage());
        }
    }

    @Override
    public void updated(DownloadJob job) {
        JobSnapshot snapshot = job.snapshot();
        broadcaster.publish(snapshot);
        broadcaster.publishDetail(snapshot);
    }

    @Override
    public void persist(DownloadJob job) {
        try {
            jobStore.save(job.snapshot());
        } catch (RuntimeException e) {
            log.error("Failed to persist job {}", job.getId(), e);
        }
    }

    @Override
    public void finished(DownloadJob job) {
        healthCheckScheduler.schedule(job);
    }
}
