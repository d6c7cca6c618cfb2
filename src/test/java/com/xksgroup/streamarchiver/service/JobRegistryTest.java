package com.xksgroup.streamarchiver.service;

import com.xksgroup.streamarchiver.config.ArchiverProperties;
import com.xksgroup.streamarchiver.config.ConfigService;
import com.xksgroup.streamarchiver.exception.JobNotFoundException;
import com.xksgroup.streamarchiver.exception.JobStateException;
import com.xksgroup.streamarchiver.model.Job.DownloadJob;
import com.xksgroup.streamarchiver.model.Job.HealthCheckResult;
import com.xksgroup.streamarchiver.model.Job.JobHooks;
import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import com.xksgroup.streamarchiver.model.Job.JobStatus;
import com.xksgroup.streamarchiver.model.Job.ManifestProgress;
import com.xksgroup.streamarchiver.model.Job.MediaKind;
import com.xksgroup.streamarchiver.model.event.DownloadEvent;
import com.xksgroup.streamarchiver.model.event.DownloadEventHandler;
import com.xksgroup.streamarchiver.repo.JobStore;
import com.xksgroup.streamarchiver.service.engine.DownloadEngine;
import com.xksgroup.streamarchiver.service.engine.EngineParameters;
import com.xksgroup.streamarchiver.service.health.HealthCheckScheduler;
import com.xksgroup.streamarchiver.service.helper.CleanDirectory;
import com.xksgroup.streamarchiver.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("JobRegistry Tests")
class JobRegistryTest {

    private static final Instant NOW = Instant.parse("2024-11-20T12:00:00Z");

    @TempDir
    Path tempDir;

    private ArchiverProperties properties;
    private JobHooks hooks;
    private JobStore jobStore;
    private HealthCheckScheduler healthCheckScheduler;
    private ExecutorService jobExecutor;
    private MutableClock clock;
    private List<StubEngine> engines;
    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new ArchiverProperties();
        ConfigService configService = mock(ConfigService.class);
        when(configService.getConfig()).thenReturn(properties);

        hooks = mock(JobHooks.class);
        jobStore = mock(JobStore.class);
        healthCheckScheduler = mock(HealthCheckScheduler.class);
        jobExecutor = Executors.newCachedThreadPool();
        clock = new MutableClock(NOW);
        engines = new ArrayList<>();

        registry = new JobRegistry(configService, parameters -> {
            StubEngine engine = new StubEngine(parameters);
            engines.add(engine);
            return engine;
        }, hooks, jobStore, healthCheckScheduler, new CleanDirectory(), jobExecutor, clock);
    }

    @AfterEach
    void tearDown() {
        jobExecutor.shutdownNow();
    }

    private static JobSnapshot storedJob(String id, JobStatus status, Instant finishTime) {
        return JobSnapshot.builder()
                .id(id)
                .videoId("vid-" + id)
                .status(status)
                .finishTime(finishTime)
                .build();
    }

    // ============================================================================
    // Creation
    // ============================================================================

    @Test
    @DisplayName("Should fill only the parameters the caller left unset")
    void testDefaultsMerge() {
        properties.getDownloader().setFfmpegPath("/usr/bin/ffmpeg");
        properties.getDownloader().setOutputDirectory("/archive");
        properties.getDownloader().setStagingDirectory("/staging");
        properties.getDownloader().setMaxVideoResolution(1080);
        properties.getDownloader().setNumParallelDownloads(3);

        DownloadJob job = registry.createJob(EngineParameters.builder()
                .url("https://youtu.be/dQw4w9WgXcQ")
                .outputDirectory("/custom")
                .maxVideoResolution(720)
                .build());

        EngineParameters merged = job.getEngine().getParameters();
        assertEquals("/usr/bin/ffmpeg", merged.getFfmpegPath());
        assertEquals("/custom", merged.getOutputDirectory());
        assertEquals(720, merged.getMaxVideoResolution());
        assertEquals(3, merged.getNumParallelDownloads());
        assertEquals(Path.of("/staging", job.getId()).toString(), merged.getStagingDirectory());
        assertNull(merged.getPoToken());
    }

    @Test
    @DisplayName("Should fall back to local directories when none are configured")
    void testDirectoryFallbacks() {
        DownloadJob job = registry.createJob(EngineParameters.builder().url("https://youtu.be/dQw4w9WgXcQ").build());

        EngineParameters merged = job.getEngine().getParameters();
        assertEquals("output", merged.getOutputDirectory());
        assertEquals(Path.of("staging", job.getId()).toString(), merged.getStagingDirectory());
        assertEquals(4320, merged.getMaxVideoResolution());
    }

    @Test
    @DisplayName("Should hand out distinct URL-safe ids")
    void testJobIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(registry.createJob(EngineParameters.builder().url("u").build()).getId());
        }
        assertEquals(50, ids.size());
        for (String id : ids) {
            assertEquals(11, id.length());
            assertTrue(id.matches("[A-Za-z0-9_-]+"), id);
        }
    }

    @Test
    @DisplayName("Should report unknown job ids")
    void testUnknownJob() {
        JobNotFoundException e = assertThrows(JobNotFoundException.class, () -> registry.getJob("nope"));
        assertEquals("No job found with ID: nope", e.getMessage());
    }

    // ============================================================================
    // Rehydration and listing
    // ============================================================================

    @Test
    @DisplayName("Should restore stored jobs and resume health checks for finished ones")
    void testRehydrate() {
        when(jobStore.loadAll()).thenReturn(List.of(
                storedJob("done", JobStatus.FINISHED, NOW.minus(Duration.ofHours(2))),
                storedJob("broken", JobStatus.ERROR, null),
                storedJob(null, JobStatus.FINISHED, NOW)));

        registry.rehydrate();

        assertEquals(JobStatus.FINISHED, registry.getJob("done").getStatus());
        assertEquals(JobStatus.ERROR, registry.getJob("broken").getStatus());
        assertNull(registry.getJob("done").getEngine());
        assertEquals(2, registry.visibleJobs().size());
        verify(healthCheckScheduler, times(1)).schedule(any(DownloadJob.class));
        verify(healthCheckScheduler).schedule(registry.getJob("done"));
    }

    @Test
    @DisplayName("Should start empty when the store cannot be read")
    void testRehydrateFailure() {
        when(jobStore.loadAll()).thenThrow(new IllegalStateException("store down"));

        assertDoesNotThrow(registry::rehydrate);
        assertTrue(registry.visibleJobs().isEmpty());
    }

    @Test
    @DisplayName("Should hide finished jobs past the retention age and sort the rest")
    void testVisibleJobs() {
        properties.getTasklist().setHideFinishedAgeDays(1);
        when(jobStore.loadAll()).thenReturn(List.of(
                storedJob("old", JobStatus.FINISHED, NOW.minus(Duration.ofDays(2))),
                storedJob("recent", JobStatus.FINISHED, NOW.minus(Duration.ofHours(3))),
                storedJob("failed", JobStatus.ERROR, null)));
        registry.rehydrate();
        DownloadJob fresh = registry.createJob(EngineParameters.builder().url("u").build());

        List<String> visible = registry.visibleJobs().stream().map(DownloadJob::getId).collect(Collectors.toList());

        assertFalse(visible.contains("old"));
        assertEquals(fresh.getId(), visible.get(0), "jobs without events come first");
        assertEquals(Set.of("recent", "failed"), Set.copyOf(visible.subList(1, 3)));
        assertEquals(3, registry.statusSummaries().size());
    }

    @Test
    @DisplayName("Should keep every finished job when retention is disabled")
    void testRetentionDisabled() {
        when(jobStore.loadAll()).thenReturn(List.of(storedJob("ancient", JobStatus.FINISHED, NOW.minus(Duration.ofDays(365)))));
        registry.rehydrate();

        assertEquals(1, registry.visibleJobs().size());
    }

    @Test
    @DisplayName("Should consider only jobs that are not unavailable as active for a video")
    void testHasActiveJobForVideo() {
        when(jobStore.loadAll()).thenReturn(List.of(
                storedJob("gone", JobStatus.UNAVAILABLE, null),
                storedJob("done", JobStatus.FINISHED, NOW)));
        registry.rehydrate();

        assertFalse(registry.hasActiveJobForVideo("vid-gone"));
        assertTrue(registry.hasActiveJobForVideo("vid-done"));
        assertFalse(registry.hasActiveJobForVideo("vid-other"));
    }

    // ============================================================================
    // Running and cancelling
    // ============================================================================

    @Test
    @DisplayName("Should run a job and cancel it on request")
    void testStartAndCancel() throws InterruptedException {
        DownloadJob job = registry.createJob(EngineParameters.builder().url("u").build());
        StubEngine engine = engines.get(0);

        registry.startJob(job);
        assertTrue(engine.started.await(5, TimeUnit.SECONDS));
        assertTrue(registry.isRunning(job.getId()));

        registry.cancelJob(job.getId());

        assertTrue(waitForStatus(job, JobStatus.CANCELLED), "job should end up cancelled");
        assertTrue(engine.cancelled);
    }

    @Test
    @DisplayName("Should forget a task that completes before startJob returns")
    void testTaskCompletingImmediately() {
        ConfigService configService = mock(ConfigService.class);
        when(configService.getConfig()).thenReturn(properties);
        JobRegistry inline = new JobRegistry(configService, parameters -> {
            StubEngine engine = new StubEngine(parameters);
            engine.cancel();
            return engine;
        }, hooks, jobStore, healthCheckScheduler, new CleanDirectory(), Runnable::run, clock);
        DownloadJob job = inline.createJob(EngineParameters.builder().url("u").build());

        inline.startJob(job);

        assertEquals(JobStatus.CANCELLED, job.getStatus());
        assertFalse(inline.isRunning(job.getId()));
        assertThrows(JobStateException.class, () -> inline.cancelJob(job.getId()));
    }

    @Test
    @DisplayName("Should refuse to cancel a job that is not running")
    void testCancelNotRunning() {
        DownloadJob job = registry.createJob(EngineParameters.builder().url("u").build());

        assertThrows(JobStateException.class, () -> registry.cancelJob(job.getId()));
        assertThrows(JobNotFoundException.class, () -> registry.cancelJob("nope"));
    }

    @Test
    @DisplayName("Should refuse to start a restored job without an engine")
    void testStartWithoutEngine() {
        when(jobStore.loadAll()).thenReturn(List.of(storedJob("done", JobStatus.FINISHED, NOW)));
        registry.rehydrate();

        assertThrows(JobStateException.class, () -> registry.startJob(registry.getJob("done")));
    }

    // ============================================================================
    // Temporary files and health checks
    // ============================================================================

    @Test
    @DisplayName("Should delete the staging files of a failed job")
    void testDeleteTempFiles() throws IOException {
        Path staging = tempDir.resolve("job-staging");
        DownloadJob job = registry.createJob(EngineParameters.builder()
                .url("https://youtu.be/dQw4w9WgXcQ")
                .stagingDirectory(staging.toString())
                .build());
        Files.createDirectories(staging);
        Files.writeString(staging.resolve("dQw4w9WgXcQ.f299.ts"), "video");
        Files.writeString(staging.resolve("dQw4w9WgXcQ.f140.ts"), "audio");

        assertThrows(JobStateException.class, () -> registry.deleteTempFiles(job.getId()), "no video id yet");

        job.handleEvent(new DownloadEvent.Fragment("dQw4w9WgXcQ.1", MediaKind.VIDEO, 1, 10, 100));
        job.handleEvent(new DownloadEvent.JobFailedOutputMove());

        assertEquals(2, registry.deleteTempFiles(job.getId()));
        assertFalse(Files.exists(staging));
        List<String> messages = job.snapshot().getMessageLog().stream()
                .map(m -> m.message()).collect(Collectors.toList());
        assertTrue(messages.contains("Deleted 2 temporary file(s)"));
    }

    @Test
    @DisplayName("Should refuse to delete files of a restored job")
    void testDeleteTempFilesWithoutEngine() {
        ManifestProgress progress = new ManifestProgress();
        progress.setOutputSize(1024L);
        JobSnapshot stored = storedJob("done", JobStatus.FINISHED, NOW);
        stored.setManifestProgress(Map.of("vid-done.0", progress));
        when(jobStore.loadAll()).thenReturn(List.of(stored));
        registry.rehydrate();

        assertTrue(registry.getJob("done").canDeleteTempFiles());
        assertThrows(JobStateException.class, () -> registry.deleteTempFiles("done"));
    }

    @Test
    @DisplayName("Should only run manual health checks on finished jobs")
    void testManualHealthCheck() throws InterruptedException {
        when(jobStore.loadAll()).thenReturn(List.of(
                storedJob("done", JobStatus.FINISHED, NOW),
                storedJob("broken", JobStatus.ERROR, null)));
        registry.rehydrate();

        assertEquals(HealthCheckResult.OK, registry.runHealthCheck("done", snapshot -> HealthCheckResult.OK));
        assertThrows(JobStateException.class,
                () -> registry.runHealthCheck("broken", snapshot -> HealthCheckResult.OK));
    }

    private static boolean waitForStatus(DownloadJob job, JobStatus expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (job.getStatus() == expected) {
                return true;
            }
            Thread.sleep(20);
        }
        return job.getStatus() == expected;
    }

    /**
     * Engine that blocks in run() until cancelled or interrupted.
     */
    private static final class StubEngine implements DownloadEngine {

        private final EngineParameters parameters;
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch stop = new CountDownLatch(1);
        private volatile boolean cancelled;

        StubEngine(EngineParameters parameters) {
            this.parameters = parameters;
        }

        @Override
        public EngineParameters getParameters() {
            return parameters;
        }

        @Override
        public void setEventHandler(DownloadEventHandler handler) {
        }

        @Override
        public void run() throws Exception {
            started.countDown();
            stop.await();
            throw new CancellationException("stopped");
        }

        @Override
        public void cancel() {
            cancelled = true;
            stop.countDown();
        }
    }
}
