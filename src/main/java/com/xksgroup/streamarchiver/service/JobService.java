package com.xksgroup.streamarchiver.service;

import com.xksgroup.streamarchiver.model.Job.DownloadJob;
import com.xksgroup.streamarchiver.model.dto.AddJobRequest;
import com.xksgroup.streamarchiver.model.player.PlayerResponse;
import com.xksgroup.streamarchiver.service.engine.EngineParameters;
import com.xksgroup.streamarchiver.service.helper.IntervalRateLimiter;
import com.xksgroup.streamarchiver.service.helper.VideoIdExtractor;
import com.xksgroup.streamarchiver.service.upstream.PlayerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Jobs requested by hand through the API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobService {

    private static final int ENGINE_POLL_INTERVAL_SECONDS = 300;

    private final JobRegistry jobRegistry;
    private final PlayerClient playerClient;
    private final IntervalRateLimiter playerRateLimiter;

    /**
     * Creates and starts a job for the requested video. Metadata is fetched up front when the
     * video id can be derived from the URL; a failed lookup does not prevent the job from starting.
     *
     * @throws IllegalArgumentException if no video id can be derived from the URL
     */
    public DownloadJob addJob(AddJobRequest request) throws InterruptedException {
        String videoId = VideoIdExtractor.extractVideoId(request.getUrl().trim());
        if (videoId == null) {
            throw new IllegalArgumentException("Could not find a video id in '" + request.getUrl() + "'");
        }

        // Looked up before the job exists, so an interrupted lookup leaves nothing behind
        playerRateLimiter.acquire();
        PlayerResponse response = playerClient.fetchPlayerResponse(videoId, true);

        EngineParameters parameters = EngineParameters.builder()
                .url(request.getUrl().trim())
                .outputDirectory(resolveOutputDirectory(request.getOutputDirectory()))
                .maxVideoResolution(request.getMaxVideoResolution())
                .pollIntervalSeconds(ENGINE_POLL_INTERVAL_SECONDS)
                .writeDescription(request.isWriteDescription())
                .writeThumbnail(request.isWriteThumbnail())
                .preferVp9(request.isPreferVp9())
                .build();
        DownloadJob job = jobRegistry.createJob(parameters);
        if (response != null) {
            job.applyMetadata(response);
        } else {
            log.warn("No metadata available for {}; starting job {} without it", videoId, job.getId());
        }

        jobRegistry.startJob(job);
        log.info("Manually added job {} for video {}", job.getId(), videoId);
        return job;
    }

    /**
     * Relative directories are placed under {@code output}; invalid ones fall back to the default.
     */
    private static String resolveOutputDirectory(String requested) {
        if (requested == null || requested.isBlank()) {
            return null;
        }
        try {
            Path path = Path.of(requested);
            if (!path.isAbsolute()) {
                path = Path.of("output").resolve(path);
            }
            Files.createDirectories(path);
            return path.toString();
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unusable output directory '{}': {}", requested, e.getMessage());
            return null;
        }
    }
}
