package com.xksgroup.streamarchiver.service.health;

import com.xksgroup.streamarchiver.config.ConfigService;
import com.xksgroup.streamarchiver.model.Job.HealthCheckResult;
import com.xksgroup.streamarchiver.model.Job.HealthChecker;
import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import com.xksgroup.streamarchiver.model.Job.ManifestProgress;
import com.xksgroup.streamarchiver.model.player.LiveBroadcastDetails;
import com.xksgroup.streamarchiver.model.player.PlayerResponse;
import com.xksgroup.streamarchiver.model.player.VideoDetails;
import com.xksgroup.streamarchiver.service.helper.IntervalRateLimiter;
import com.xksgroup.streamarchiver.service.upstream.PlayerClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Verifies that a finished archive still matches its upstream source.
 */
@Slf4j
@Service
public class HealthCheckService implements HealthChecker {

    private final PlayerClient playerClient;
    private final IntervalRateLimiter rateLimiter;

    @Autowired
    public HealthCheckService(PlayerClient playerClient, ConfigService configService) {
        this(playerClient, new IntervalRateLimiter("healthcheck",
                configService.getConfig().getHealthchecks().getRequestInterval()));
    }

    HealthCheckService(PlayerClient playerClient, IntervalRateLimiter rateLimiter) {
        this.playerClient = playerClient;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public HealthCheckResult check(JobSnapshot job) throws InterruptedException {
        if (job.getVideoId() == null) {
            return HealthCheckResult.HEALTHCHECK_FAILURE;
        }
        // overlapping segments across manifests make the archived length ambiguous
        if (job.getManifestProgress().size() != 1) {
            return HealthCheckResult.STREAM_LENGTH_INDETERMINATE;
        }
        ManifestProgress progress = job.getManifestProgress().values().iterator().next();
        Double archivedSeconds = progress.getOutputTimeSeconds();
        if (archivedSeconds == null) {
            return HealthCheckResult.STREAM_LENGTH_INDETERMINATE;
        }

        rateLimiter.acquire();
        PlayerResponse response = playerClient.fetchPlayerResponse(job.getVideoId(), false);
        if (response == null || response.getPlayabilityStatus() == null) {
            return HealthCheckResult.HEALTHCHECK_FAILURE;
        }
        if (response.getPlayabilityStatus().isLoginRequired()) {
            return HealthCheckResult.VIDEO_UNAVAILABLE;
        }
        VideoDetails details = response.getVideoDetails();
        if (details == null) {
            return HealthCheckResult.HEALTHCHECK_FAILURE;
        }

        Long upstreamSeconds = details.getVideoDurationSeconds();
        if (details.isLiveContent() && upstreamSeconds != null
                && Math.abs(archivedSeconds - upstreamSeconds) > 1) {
            LiveBroadcastDetails broadcast = response.getLiveBroadcastDetails();
            Long estimated = broadcast != null ? broadcast.getEstimatedDurationSeconds() : null;
            if (estimated != null && estimated > upstreamSeconds) {
                // upstream is still finalizing the broadcast
                return HealthCheckResult.OK;
            }
            log.info("Job {} archived {}s but upstream reports {}s", job.getId(), archivedSeconds, upstreamSeconds);
            return HealthCheckResult.STREAM_LENGTH_DIFFERS;
        }
        return HealthCheckResult.OK;
    }
}
