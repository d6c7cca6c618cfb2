package com.xksgroup.streamarchiver.service.feed;

import com.xksgroup.streamarchiver.config.ArchiverProperties.ChannelMonitorConfig;
import com.xksgroup.streamarchiver.config.ConfigChangeSignal;
import com.xksgroup.streamarchiver.config.ConfigService;
import com.xksgroup.streamarchiver.model.FeedItemMatch;
import com.xksgroup.streamarchiver.model.Job.DownloadJob;
import com.xksgroup.streamarchiver.model.player.PlayerResponse;
import com.xksgroup.streamarchiver.model.player.VideoDetails;
import com.xksgroup.streamarchiver.repo.SeenItemStore;
import com.xksgroup.streamarchiver.service.JobRegistry;
import com.xksgroup.streamarchiver.service.engine.EngineParameters;
import com.xksgroup.streamarchiver.service.helper.IntervalRateLimiter;
import com.xksgroup.streamarchiver.service.notification.Notifier;
import com.xksgroup.streamarchiver.service.upstream.PlayerClient;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Background loop that polls every monitored channel, filters out videos it has already handled,
 * and starts an archival job for each new eligible match.
 */
@Slf4j
@Service
public class FeedMonitorDaemon {

    static final String FOUND_TAG = "monitor-feed:found";
    private static final int ENGINE_POLL_INTERVAL_SECONDS = 300;

    private final ConfigService configService;
    private final FeedPoller feedPoller;
    private final SeenItemStore seenItemStore;
    private final JobRegistry jobRegistry;
    private final PlayerClient playerClient;
    private final IntervalRateLimiter playerRateLimiter;
    private final Notifier notifier;
    private final ExecutorService feedExecutor;

    private volatile Thread worker;

    public FeedMonitorDaemon(ConfigService configService,
                             FeedPoller feedPoller,
                             SeenItemStore seenItemStore,
                             JobRegistry jobRegistry,
                             PlayerClient playerClient,
                             IntervalRateLimiter playerRateLimiter,
                             Notifier notifier,
                             @Qualifier("feedExecutor") ExecutorService feedExecutor) {
        this.configService = configService;
        this.feedPoller = feedPoller;
        this.seenItemStore = seenItemStore;
        this.jobRegistry = jobRegistry;
        this.playerClient = playerClient;
        this.playerRateLimiter = playerRateLimiter;
        this.notifier = notifier;
        this.feedExecutor = feedExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        Thread thread = new Thread(this::monitor, "feed-monitor");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
    }

    @PreDestroy
    public void stop() {
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }
    }

    private void monitor() {
        log.info("Feed monitor started");
        ConfigChangeSignal changed = configService.newChangeSignal();
        changed.clear();
        try {
            while (!Thread.currentThread().isInterrupted()) {
                while (configService.getChannels().isEmpty()) {
                    log.warn("No channels configured for monitoring; feed polling suspended until the configuration changes");
                    changed.await();
                    changed.clear();
                }
                int scheduled = pollOnce();
                if (scheduled > 0) {
                    log.info("Scheduled {} new job(s) from channel feeds", scheduled);
                }
                Thread.sleep(configService.getConfig().getFeed().getPollInterval().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            configService.releaseChangeSignal(changed);
            log.info("Feed monitor stopped");
        }
    }

    /**
     * Polls every configured channel concurrently and schedules the new matches.
     * A channel whose feed cannot be fetched is skipped until the next round.
     *
     * @return the number of jobs started
     */
    public int pollOnce() throws InterruptedException {
        Map<ChannelMonitorConfig, Future<List<FeedItemMatch>>> results = new LinkedHashMap<>();
        for (ChannelMonitorConfig channel : configService.getChannels()) {
            results.put(channel, feedExecutor.submit(() -> feedPoller.getChannelMatches(channel)));
        }

        int scheduled = 0;
        for (Map.Entry<ChannelMonitorConfig, Future<List<FeedItemMatch>>> result : results.entrySet()) {
            List<FeedItemMatch> matches;
            try {
                matches = result.getValue().get();
            } catch (ExecutionException e) {
                log.warn("Skipping channel {} this round: {}", result.getKey().getId(), e.getCause().getMessage());
                continue;
            }
            for (FeedItemMatch match : matches) {
                try {
                    if (scheduleFeedMatch(match)) {
                        scheduled++;
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to schedule video {} from channel {}", match.videoId(), result.getKey().getId(), e);
                }
            }
        }
        return scheduled;
    }

    /**
     * @return {@code true} if a job was started for the match
     */
    boolean scheduleFeedMatch(FeedItemMatch match) throws InterruptedException {
        String videoId = match.videoId();
        if (videoId == null || videoId.isEmpty()) {
            return false;
        }
        if (jobRegistry.hasActiveJobForVideo(videoId)) {
            return false;
        }
        if (seenItemStore.containsOrInsert(videoId)) {
            return false;
        }

        playerRateLimiter.acquire();
        PlayerResponse response = playerClient.fetchPlayerResponse(videoId, true);
        if (response == null || response.getVideoDetails() == null) {
            // unavailable for now; forget it so the next poll looks again
            seenItemStore.remove(videoId);
            return false;
        }
        VideoDetails details = response.getVideoDetails();
        if (!details.isArchivable() || !(details.isLiveContent() || match.channel().isIncludeNonLiveContent())) {
            log.debug("Video {} matched {} but is not eligible for archiving", videoId, match.matchingTerms());
            return false;
        }

        EngineParameters parameters = EngineParameters.builder()
                .url(match.url())
                .outputDirectory(outputDirectoryFor(match.channel()))
                .pollIntervalSeconds(ENGINE_POLL_INTERVAL_SECONDS)
                .writeDescription(true)
                .writeThumbnail(true)
                .preferVp9(true)
                .numParallelDownloads(configService.getConfig().getDownloader().getNumParallelDownloads())
                .build();
        DownloadJob job = jobRegistry.createJob(parameters);
        job.applyMetadata(response);
        String terms = String.join(", ", match.matchingTerms());
        job.appendMessage("Found stream with matching terms: " + terms);
        jobRegistry.startJob(job);

        log.info("Started job {} for {} ({})", job.getId(), videoId, terms);
        notifier.notify(null,
                match.displayAuthor() + " is doing a stream matching: " + terms + " @ https://youtu.be/" + details.getVideoId(),
                FOUND_TAG);
        return true;
    }

    private String outputDirectoryFor(ChannelMonitorConfig channel) {
        String directory = channel.getOutputDirectory();
        if (directory == null) {
            directory = configService.getConfig().getDownloader().getOutputDirectory();
        }
        if (directory == null) {
            directory = "output";
        }
        try {
            Files.createDirectories(Path.of(directory));
        } catch (IOException | RuntimeException e) {
            log.warn("Could not create output directory {}: {}", directory, e.getMessage());
        }
        return directory;
    }
}
