package com.xksgroup.streamarchiver.service;

import com.xksgroup.streamarchiver.config.ArchiverProperties;
import com.xksgroup.streamarchiver.config.ArchiverProperties.DownloaderConfig;
import com.xksgroup.streamarchiver.config.ConfigService;
import com.xksgroup.streamarchiver.exception.JobNotFoundException;
import com.xksgroup.streamarchiver.exception.JobStateException;
import com.xksgroup.streamarchiver.model.Job.DownloadJob;
import com.xksgroup.streamarchiver.model.Job.HealthCheckResult;
import com.xksgroup.streamarchiver.model.Job.HealthChecker;
import com.xksgroup.streamarchiver.model.Job.JobHooks;
import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import com.xksgroup.streamarchiver.model.Job.JobSortKey;
import com.xksgroup.streamarchiver.model.Job.JobStatus;
import com.xksgroup.streamarchiver.model.Job.JobStatusSummary;
import com.xksgroup.streamarchiver.repo.JobStore;
import com.xksgroup.streamarchiver.service.engine.DownloadEngine;
import com.xksgroup.streamarchiver.service.engine.DownloadEngineFactory;
import com.xksgroup.streamarchiver.service.engine.EngineParameters;
import com.xksgroup.streamarchiver.service.health.HealthCheckScheduler;
import com.xksgroup.streamarchiver.service.helper.CleanDirectory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Owns every known job: creates them with engine defaults from the configuration, starts and
 * cancels their download tasks, and restores finished work from the store at startup.
 */
@Slf4j
@Service
public class JobRegistry {

    private static final int ID_BYTES = 8;

    private final Map<String, DownloadJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> runningTasks = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();

    private final ConfigService configService;
    private final DownloadEngineFactory engineFactory;
    private final JobHooks hooks;
    private final JobStore jobStore;
    private final HealthCheckScheduler healthCheckScheduler;
    private final CleanDirectory cleanDirectory;
    private final Executor jobExecutor;
    private final Clock clock;

    public JobRegistry(ConfigService configService,
                       DownloadEngineFactory engineFactory,
                       JobHooks hooks,
                       JobStore jobStore,
                       HealthCheckScheduler healthCheckScheduler,
                       CleanDirectory cleanDirectory,
                       @Qualifier("jobExecutor") Executor jobExecutor,
                       Clock clock) {
        this.configService = configService;
        this.engineFactory = engineFactory;
        this.hooks = hooks;
        this.jobStore = jobStore;
        this.healthCheckScheduler = healthCheckScheduler;
        this.cleanDirectory = cleanDirectory;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
    }

    /**
     * Restores persisted jobs. Records that cannot be decoded are skipped and left in the store.
     */
    @PostConstruct
    public void rehydrate() {
        List<JobSnapshot> snapshots;
        try {
            snapshots = jobStore.loadAll();
        } catch (RuntimeException e) {
            log.error("Could not load stored jobs; starting with an empty registry", e);
            return;
        }
        int restored = 0;
        for (JobSnapshot snapshot : snapshots) {
            if (snapshot.getId() == null) {
                log.warn("Skipping stored job without an id");
                continue;
            }
            DownloadJob job = DownloadJob.fromSnapshot(snapshot, hooks, clock);
            jobs.put(job.getId(), job);
            restored++;
            if (job.getStatus() == JobStatus.FINISHED) {
                healthCheckScheduler.schedule(job);
            }
        }
        log.info("Restored {} job(s) from the store", restored);
    }

    /**
     * Creates a job with a fresh id. Configuration defaults fill only the parameters left unset.
     */
    public synchronized DownloadJob createJob(EngineParameters parameters) {
        String id = newJobId();
        applyDefaults(parameters, id);
        DownloadEngine engine = engineFactory.create(parameters);
        DownloadJob job = new DownloadJob(id, engine, hooks, clock);
        jobs.put(id, job);
        log.info("Created job {} for {}", id, parameters.getUrl());
        return job;
    }

    /**
     * Runs the job's download task on its own thread.
     */
    public void startJob(DownloadJob job) {
        if (job.getEngine() == null) {
            throw new JobStateException("Job " + job.getId() + " has no download engine and cannot be started");
        }
        // Registered before it can run so that its own removal always comes last
        FutureTask<Void> task = new FutureTask<>(job::run, null);
        runningTasks.put(job.getId(), task);
        try {
            jobExecutor.execute(() -> {
                try {
                    task.run();
                } finally {
                    runningTasks.remove(job.getId(), task);
                }
            });
        } catch (RejectedExecutionException e) {
            runningTasks.remove(job.getId(), task);
            throw e;
        }
    }

    /**
     * Stops a running job. The job turns CANCELLED once its task notices.
     */
    public void cancelJob(String jobId) {
        DownloadJob job = getJob(jobId);
        Future<?> task = runningTasks.get(jobId);
        if (task == null || task.isDone()) {
            throw new JobStateException("Job " + jobId + " is not running");
        }
        log.info("Cancelling job {}", jobId);
        job.cancel();
        task.cancel(true);
    }

    /**
     * Whether the job's task is still executing, including a cancelled task that is winding down.
     */
    public boolean isRunning(String jobId) {
        return runningTasks.containsKey(jobId);
    }

    public DownloadJob getJob(String jobId) {
        DownloadJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    /**
     * Whether a job for this video exists that is not {@link JobStatus#UNAVAILABLE}.
     */
    public boolean hasActiveJobForVideo(String videoId) {
        return jobs.values().stream()
                .anyMatch(job -> videoId.equals(job.getVideoId()) && job.getStatus() != JobStatus.UNAVAILABLE);
    }

    /**
     * Jobs for display, minus those finished longer ago than the configured retention, in display order.
     */
    public List<DownloadJob> visibleJobs() {
        Duration hideAfter = configService.getConfig().getTasklist().getHideFinishedAge();
        Instant now = clock.instant();
        List<DownloadJob> visible = jobs.values().stream()
                .filter(job -> !isHidden(job, hideAfter, now))
                .collect(Collectors.toCollection(ArrayList::new));
        JobSortKey.sortStable(visible, DownloadJob::sortKey);
        return visible;
    }

    private static boolean isHidden(DownloadJob job, Duration hideAfter, Instant now) {
        if (hideAfter == null || job.getStatus() != JobStatus.FINISHED) {
            return false;
        }
        Instant finished = job.getFinishTime();
        return finished != null && finished.plus(hideAfter).isBefore(now);
    }

    public List<JobStatusSummary> statusSummaries() {
        return visibleJobs().stream().map(DownloadJob::statusSummary).collect(Collectors.toList());
    }

    /**
     * Removes the job's staging files.
     *
     * @return the number of files deleted
     */
    public int deleteTempFiles(String jobId) {
        DownloadJob job = getJob(jobId);
        if (!job.canDeleteTempFiles()) {
            throw new JobStateException("Temporary files of job " + jobId + " cannot be deleted while "
                    + job.getStatus());
        }
        if (job.getEngine() == null || job.getEngine().getParameters().getStagingDirectory() == null) {
            throw new JobStateException("Job " + jobId + " has no staging directory to clean");
        }
        Path stagingDirectory = Path.of(job.getEngine().getParameters().getStagingDirectory());
        int deleted = cleanDirectory.cleanStagingFiles(stagingDirectory, job.getVideoId());
        job.appendMessage("Deleted " + deleted + " temporary file(s)");
        hooks.updated(job);
        return deleted;
    }

    public HealthCheckResult runHealthCheck(String jobId, HealthChecker checker) throws InterruptedException {
        DownloadJob job = getJob(jobId);
        if (job.getStatus() != JobStatus.FINISHED) {
            throw new JobStateException("Job " + jobId + " is not finished");
        }
        return job.runHealthCheck(checker);
    }

    private void applyDefaults(EngineParameters parameters, String jobId) {
        ArchiverProperties config = configService.getConfig();
        DownloaderConfig downloader = config.getDownloader();
        if (parameters.getFfmpegPath() == null) {
            parameters.setFfmpegPath(downloader.getFfmpegPath());
        }
        if (parameters.getPoToken() == null) {
            parameters.setPoToken(downloader.getPoToken());
        }
        if (parameters.getVisitorData() == null) {
            parameters.setVisitorData(downloader.getVisitorData());
        }
        if (parameters.getStagingDirectory() == null) {
            parameters.setStagingDirectory(stagingDirectoryFor(jobId).toString());
        }
        if (parameters.getOutputDirectory() == null) {
            parameters.setOutputDirectory(downloader.getOutputDirectory() != null
                    ? downloader.getOutputDirectory() : "output");
        }
        if (parameters.getCookieFile() == null) {
            parameters.setCookieFile(downloader.getCookieFile());
        }
        if (parameters.getOutputTemplate() == null) {
            parameters.setOutputTemplate(downloader.getOutputTemplate());
        }
        if (parameters.getMaxVideoResolution() == null) {
            parameters.setMaxVideoResolution(downloader.getMaxVideoResolution());
        }
        if (parameters.getNumParallelDownloads() == null) {
            parameters.setNumParallelDownloads(downloader.getNumParallelDownloads());
        }
    }

    private Path stagingDirectoryFor(String jobId) {
        String base = configService.getConfig().getDownloader().getStagingDirectory();
        return Path.of(base != null ? base : "staging", jobId);
    }

    private String newJobId() {
        byte[] bytes = new byte[ID_BYTES];
        String id;
        do {
            random.nextBytes(bytes);
            id = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        } while (jobs.containsKey(id));
        return id;
    }
}
