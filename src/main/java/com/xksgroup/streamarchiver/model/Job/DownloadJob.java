package com.xksgroup.streamarchiver.model.Job;

import com.xksgroup.streamarchiver.model.event.DownloadEvent;
import com.xksgroup.streamarchiver.model.event.DownloadEventHandler;
import com.xksgroup.streamarchiver.model.player.PlayerResponse;
import com.xksgroup.streamarchiver.model.player.VideoDetails;
import com.xksgroup.streamarchiver.service.engine.DownloadEngine;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * State of one archival job, driven by the download engine's event stream.
 * <p>
 * All mutation happens through {@link #handleEvent}, {@link #run} and {@link #runHealthCheck},
 * which serialize on the job's monitor. Readers should work from {@link #snapshot()}.
 */
@Slf4j
public class DownloadJob implements DownloadEventHandler {

    private static final List<HealthCheckStep> HEALTH_CHECK_SCHEDULE = List.of(
            new HealthCheckStep(Duration.ofHours(1), Duration.ofMinutes(5)),
            new HealthCheckStep(Duration.ofHours(6), Duration.ofMinutes(30)),
            new HealthCheckStep(Duration.ofDays(1), Duration.ofHours(1)),
            new HealthCheckStep(Duration.ofDays(3), Duration.ofHours(4))
    );

    private final String id;
    private final DownloadEngine engine;
    private final JobHooks hooks;
    private final Clock clock;

    private String author;
    private String channelId;
    private String videoId;
    private Instant scheduledStartTime;
    private String thumbnailUrl;
    private String title;
    private String currentManifest;
    private JobStatus status = JobStatus.UNKNOWN;
    private Instant finishTime;
    private final List<JobLogMessage> messageLog = new ArrayList<>();
    private final Map<String, ManifestProgress> manifestProgress = new LinkedHashMap<>();
    private HealthCheckStatus healthCheck = new HealthCheckStatus();
    private final Set<String> outputPaths = new LinkedHashSet<>();

    /**
     * @param engine may be {@code null} for jobs restored from the store
     */
    public DownloadJob(String id, DownloadEngine engine, JobHooks hooks, Clock clock) {
        this.id = id;
        this.engine = engine;
        this.hooks = hooks;
        this.clock = clock;
    }

    /**
     * Rebuilds a job from a stored snapshot. The restored job has no engine.
     */
    public static DownloadJob fromSnapshot(JobSnapshot snapshot, JobHooks hooks, Clock clock) {
        DownloadJob job = new DownloadJob(snapshot.getId(), null, hooks, clock);
        job.author = snapshot.getAuthor();
        job.channelId = snapshot.getChannelId();
        job.videoId = snapshot.getVideoId();
        job.scheduledStartTime = snapshot.getScheduledStartTime();
        job.thumbnailUrl = snapshot.getThumbnailUrl();
        job.title = snapshot.getTitle();
        job.currentManifest = snapshot.getCurrentManifest();
        job.status = snapshot.getStatus() != null ? snapshot.getStatus() : JobStatus.UNKNOWN;
        job.finishTime = snapshot.getFinishTime();
        if (snapshot.getMessageLog() != null) {
            job.messageLog.addAll(snapshot.getMessageLog());
        }
        if (snapshot.getManifestProgress() != null) {
            snapshot.getManifestProgress().forEach((k, v) -> job.manifestProgress.put(k, v.copy()));
        }
        if (snapshot.getHealthCheck() != null) {
            job.healthCheck = snapshot.getHealthCheck().copy();
        }
        if (snapshot.getOutputPaths() != null) {
            job.outputPaths.addAll(snapshot.getOutputPaths());
        }
        return job;
    }

    // ------------------------------------------------------------------ //
    // Event handling

    @Override
    public void handleEvent(DownloadEvent event) {
        synchronized (this) {
            JobStatus previous = status;
            switch (event.kind()) {
                case STREAM_INFO:
                    onStreamInfo((DownloadEvent.StreamInfo) event);
                    break;
                case FRAGMENT:
                    onFragment((DownloadEvent.Fragment) event);
                    break;
                case JOB_FINISHED:
                    onFinished((DownloadEvent.JobFinished) event);
                    break;
                case JOB_FAILED_OUTPUT_MOVE:
                    transition(JobStatus.ERROR);
                    break;
                case STREAM_MUX:
                    transition(JobStatus.MUXING);
                    appendMessage("Started remux process");
                    break;
                case STREAM_MUX_PROGRESS:
                    onMuxProgress((DownloadEvent.StreamMuxProgress) event);
                    break;
                case STREAM_UNAVAILABLE:
                    transition(JobStatus.UNAVAILABLE);
                    break;
                case FORMAT_SELECTION:
                    appendMessage(describeFormat((DownloadEvent.FormatSelection) event));
                    break;
                case FREE_TEXT:
                    appendMessage(((DownloadEvent.FreeText) event).text());
                    break;
                case UNRECOGNIZED:
                default:
                    log.debug("Job {} ignoring event {}", id, event);
                    break;
            }
            if (previous != status) {
                log.info("Job {} status changed from {} to {}", id, previous, status);
                fireHook("statusChanged", hooks::statusChanged);
            }
        }
        fireHook("updated", hooks::updated);
    }

    private void onStreamInfo(DownloadEvent.StreamInfo info) {
        if (info.videoTitle() != null) {
            title = info.videoTitle();
        }
        transition(JobStatus.WAITING);
        Instant scheduled = info.scheduledStart();
        if (scheduled != null && !scheduled.equals(scheduledStartTime)) {
            if (scheduledStartTime != null) {
                appendMessage("Scheduled start time changed to " + scheduled);
            }
            scheduledStartTime = scheduled;
        }
    }

    private void onFragment(DownloadEvent.Fragment fragment) {
        transition(JobStatus.DOWNLOADING);
        String manifestId = fragment.manifestId();
        if (manifestId == null) {
            return;
        }
        manifestProgress.computeIfAbsent(manifestId, k -> new ManifestProgress())
                .recordFragment(fragment.mediaType(), fragment.currentFragment(), fragment.maxFragments(),
                        fragment.fragmentSize(), clock.instant());
        currentManifest = manifestId;
        videoId = manifestId.split("\\.", 2)[0];
    }

    private void onFinished(DownloadEvent.JobFinished finished) {
        if (status.isTerminal() && status != JobStatus.FINISHED) {
            log.debug("Job {} ignoring finish event while {}", id, status);
            return;
        }
        transition(JobStatus.FINISHED);
        appendMessage("Finished downloading");
        finishTime = clock.instant();
        outputPaths.clear();
        if (finished.outputPaths() != null) {
            outputPaths.addAll(finished.outputPaths());
        }
        fireHook("persist", hooks::persist);
        fireHook("finished", hooks::finished);
    }

    private void onMuxProgress(DownloadEvent.StreamMuxProgress progress) {
        if (progress.manifestId() == null || progress.progress() == null) {
            return;
        }
        manifestProgress.computeIfAbsent(progress.manifestId(), k -> new ManifestProgress())
                .recordMuxProgress(progress.progress().outTimeSeconds(), progress.progress().totalSize());
    }

    /**
     * Terminal states absorb every later engine event.
     */
    private void transition(JobStatus next) {
        if (status == next) {
            return;
        }
        if (status.isTerminal()) {
            log.debug("Job {} staying {} instead of moving to {}", id, status, next);
            return;
        }
        status = next;
    }

    static String describeFormat(DownloadEvent.FormatSelection selection) {
        DownloadEvent.FormatInfo format = selection.format();
        String majorType = selection.majorType() != null ? selection.majorType().displayName() : "Unknown";
        if (format == null) {
            return majorType + " format selected (manifest " + selection.manifestId() + ")";
        }
        String codec = format.codec() != null && !format.codec().isBlank() ? format.codec() : "unknown codec";
        String details = "(itag " + format.itag() + ", manifest " + selection.manifestId()
                + ", duration " + format.targetDurationSec() + ")";
        if (selection.majorType() == MediaKind.VIDEO) {
            if (codec.startsWith("avc1")) {
                codec = "h264";
            }
            return majorType + " format: " + format.qualityLabel() + " " + codec + " " + details;
        }
        if (format.bitrate() != null && format.bitrate() > 0) {
            return majorType + " format: " + (format.bitrate() / 1000) + "k " + codec + " " + details;
        }
        return majorType + " format selected (manifest " + selection.manifestId()
                + ", duration " + format.targetDurationSec() + ")";
    }

    // ------------------------------------------------------------------ //
    // Task lifecycle

    /**
     * Attaches this job to its engine and blocks until the engine is done. Never throws:
     * cancellation and failures end up in the job's status and message log.
     */
    public void run() {
        if (engine == null) {
            log.warn("Job {} has no download engine attached; nothing to run", id);
            return;
        }
        synchronized (this) {
            if (status.isTerminal()) {
                // A fresh event stream for the same job starts from scratch
                status = JobStatus.UNKNOWN;
            }
            engine.setEventHandler(this);
            appendMessage("Started download task");
        }
        fireHook("updated", hooks::updated);

        try {
            engine.run();
        } catch (CancellationException e) {
            onCancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onCancelled();
        } catch (Exception e) {
            onFailure(e);
        }
    }

    /**
     * Asks the engine to stop. The job turns CANCELLED once its {@link #run()} observes it.
     */
    public void cancel() {
        if (engine != null) {
            engine.cancel();
        }
    }

    private void onCancelled() {
        synchronized (this) {
            JobStatus previous = status;
            transition(JobStatus.CANCELLED);
            appendMessage("Download task was cancelled");
            log.info("Job {} cancelled", id);
            if (previous != status) {
                fireHook("statusChanged", hooks::statusChanged);
            }
        }
        fireHook("updated", hooks::updated);
    }

    private void onFailure(Exception e) {
        synchronized (this) {
            JobStatus previous = status;
            transition(JobStatus.ERROR);
            log.error("Job {} failed: {}", id, e.getMessage(), e);
            appendMessage("Exception: " + e);
            StringWriter trace = new StringWriter();
            e.printStackTrace(new PrintWriter(trace));
            appendMessage(trace.toString());
            if (previous != status) {
                fireHook("statusChanged", hooks::statusChanged);
            }
            fireHook("persist", hooks::persist);
        }
        fireHook("updated", hooks::updated);
    }

    /**
     * Hook failures are logged and go no further, so they can neither abort the engine nor
     * escape {@link #run()}.
     */
    private void fireHook(String name, Consumer<DownloadJob> hook) {
        try {
            hook.accept(this);
        } catch (RuntimeException e) {
            log.warn("Job {} {} hook failed: {}", id, name, e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------ //
    // Health checks

    /**
     * How long to wait before the next scheduled health check, or {@code null} once the job
     * is old enough (or has no finish time) and should no longer be checked.
     */
    public Duration nextHealthCheckDelay() {
        Instant finished;
        synchronized (this) {
            finished = finishTime;
        }
        if (finished == null) {
            return null;
        }
        Duration elapsed = Duration.between(finished, clock.instant());
        for (HealthCheckStep step : HEALTH_CHECK_SCHEDULE) {
            if (elapsed.compareTo(step.within()) <= 0) {
                return step.interval();
            }
        }
        return null;
    }

    /**
     * Runs one health check outside the job's lock and records the result.
     */
    public HealthCheckResult runHealthCheck(HealthChecker checker) throws InterruptedException {
        HealthCheckResult result;
        try {
            result = checker.check(snapshot());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Health check for job {} failed: {}", id, e.getMessage());
            result = HealthCheckResult.HEALTHCHECK_FAILURE;
        }
        synchronized (this) {
            healthCheck = new HealthCheckStatus(result, clock.instant());
            if (status == JobStatus.FINISHED) {
                fireHook("persist", hooks::persist);
            }
        }
        fireHook("updated", hooks::updated);
        return result;
    }

    private record HealthCheckStep(Duration within, Duration interval) {
    }

    // ------------------------------------------------------------------ //
    // Queries and seeding

    public synchronized JobSortKey sortKey() {
        Instant reference;
        switch (status) {
            case FINISHED:
                reference = finishTime;
                break;
            case WAITING:
                reference = scheduledStartTime;
                break;
            default:
                reference = messageLog.isEmpty() ? null : messageLog.get(messageLog.size() - 1).eventTime();
                break;
        }
        return new JobSortKey(status.getSortPriority(), reference);
    }

    /**
     * Temporary files may go once the job is over, unless a finished job has a manifest
     * whose mux output size was never reported (the mux may be incomplete).
     */
    public synchronized boolean canDeleteTempFiles() {
        if (videoId == null || !status.allowsTempFileDeletion()) {
            return false;
        }
        if (status == JobStatus.FINISHED) {
            return manifestProgress.values().stream().allMatch(p -> p.getOutputSize() != null);
        }
        return true;
    }

    public synchronized void appendMessage(String message) {
        messageLog.add(new JobLogMessage(clock.instant(), message));
    }

    /**
     * Copies descriptive fields from upstream metadata.
     */
    public synchronized void applyMetadata(PlayerResponse response) {
        VideoDetails details = response.getVideoDetails();
        if (details != null) {
            videoId = details.getVideoId();
            author = details.getAuthor();
            channelId = details.getChannelId();
            thumbnailUrl = details.getBestThumbnailUrl();
            if (title == null) {
                title = details.getTitle();
            }
        }
        if (response.getPlayabilityStatus() != null) {
            scheduledStartTime = response.getPlayabilityStatus().getScheduledStartTime();
        }
    }

    public synchronized JobStatusSummary statusSummary() {
        long video = 0, audio = 0, max = 0, total = 0;
        for (ManifestProgress p : manifestProgress.values()) {
            video += p.getVideoSeq();
            audio += p.getAudioSeq();
            max += p.getMaxSeq();
            total += p.getTotalDownloaded();
        }
        return new JobStatusSummary(id, video, audio, max, total, status);
    }

    public synchronized JobSnapshot snapshot() {
        Map<String, ManifestProgress> progressCopy = new LinkedHashMap<>();
        manifestProgress.forEach((k, v) -> progressCopy.put(k, v.copy()));
        return JobSnapshot.builder()
                .id(id)
                .author(author)
                .channelId(channelId)
                .videoId(videoId)
                .scheduledStartTime(scheduledStartTime)
                .thumbnailUrl(thumbnailUrl)
                .title(title)
                .currentManifest(currentManifest)
                .status(status)
                .finishTime(finishTime)
                .messageLog(new ArrayList<>(messageLog))
                .manifestProgress(progressCopy)
                .healthCheck(healthCheck.copy())
                .outputPaths(new LinkedHashSet<>(outputPaths))
                .build();
    }

    public String getId() {
        return id;
    }

    public DownloadEngine getEngine() {
        return engine;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized String getVideoId() {
        return videoId;
    }

    public synchronized String getTitle() {
        return title;
    }

    public synchronized String getAuthor() {
        return author;
    }

    public synchronized Instant getFinishTime() {
        return finishTime;
    }
}
