package com.xksgroup.streamarchiver.service.health;

import com.xksgroup.streamarchiver.config.ConfigService;
import com.xksgroup.streamarchiver.model.Job.DownloadJob;
import com.xksgroup.streamarchiver.model.Job.HealthChecker;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Re-checks finished jobs on an escalating schedule until they are old enough to be left alone.
 * Each job has at most one pending check.
 */
@Slf4j
@Service
public class HealthCheckScheduler {

    private final HealthChecker healthChecker;
    private final ConfigService configService;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    @Autowired
    public HealthCheckScheduler(HealthChecker healthChecker, ConfigService configService) {
        this(healthChecker, configService, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-check");
            thread.setDaemon(true);
            return thread;
        }));
    }

    HealthCheckScheduler(HealthChecker healthChecker, ConfigService configService,
                         ScheduledExecutorService scheduler) {
        this.healthChecker = healthChecker;
        this.configService = configService;
        this.scheduler = scheduler;
    }

    /**
     * Starts the check cycle for a job unless one is already pending.
     *
     * @return {@code true} if a check was scheduled
     */
    public boolean schedule(DownloadJob job) {
        Duration delay = job.nextHealthCheckDelay();
        if (delay == null) {
            log.debug("Job {} is past its health check window", job.getId());
            return false;
        }
        if (pending.containsKey(job.getId())) {
            return false;
        }
        scheduleNext(job, delay);
        return true;
    }

    public boolean isScheduled(String jobId) {
        return pending.containsKey(jobId);
    }

    private void scheduleNext(DownloadJob job, Duration delay) {
        log.debug("Next health check for job {} in {}", job.getId(), delay);
        pending.put(job.getId(), scheduler.schedule(() -> runCycle(job), delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    void runCycle(DownloadJob job) {
        pending.remove(job.getId());
        if (configService.getConfig().getHealthchecks().isEnableScheduled()) {
            try {
                job.runHealthCheck(healthChecker);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Scheduled health check for job {} failed", job.getId(), e);
            }
        }
        Duration next = job.nextHealthCheckDelay();
        if (next == null) {
            log.info("Stopping scheduled health checks for job {}", job.getId());
            return;
        }
        if (!scheduler.isShutdown()) {
            scheduleNext(job, next);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
