package com.xksgroup.streamarchiver.service.health;

import com.xksgroup.streamarchiver.model.Job.HealthCheckResult;
import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import com.xksgroup.streamarchiver.model.Job.ManifestProgress;
import com.xksgroup.streamarchiver.model.player.LiveBroadcastDetails;
import com.xksgroup.streamarchiver.model.player.PlayabilityStatus;
import com.xksgroup.streamarchiver.model.player.PlayerResponse;
import com.xksgroup.streamarchiver.model.player.VideoDetails;
import com.xksgroup.streamarchiver.service.helper.IntervalRateLimiter;
import com.xksgroup.streamarchiver.service.upstream.PlayerClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("HealthCheckService Tests")
class HealthCheckServiceTest {

    private static final String VIDEO_ID = "vid00000001";

    private PlayerClient playerClient;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        playerClient = mock(PlayerClient.class);
        healthCheckService = new HealthCheckService(playerClient, new IntervalRateLimiter("test", Duration.ZERO));
    }

    private static JobSnapshot finishedJob(Double... outputSeconds) {
        Map<String, ManifestProgress> progress = new LinkedHashMap<>();
        for (int i = 0; i < outputSeconds.length; i++) {
            ManifestProgress manifest = new ManifestProgress();
            manifest.setOutputTimeSeconds(outputSeconds[i]);
            progress.put(VIDEO_ID + "." + i, manifest);
        }
        return JobSnapshot.builder()
                .id("job-1")
                .videoId(VIDEO_ID)
                .manifestProgress(progress)
                .build();
    }

    private static PlayerResponse response(String status, String lengthSeconds, boolean liveContent) {
        PlayabilityStatus playability = new PlayabilityStatus();
        playability.setStatus(status);
        VideoDetails details = new VideoDetails();
        details.setVideoId(VIDEO_ID);
        details.setLengthSeconds(lengthSeconds);
        details.setLiveContent(liveContent);
        PlayerResponse response = new PlayerResponse();
        response.setPlayabilityStatus(playability);
        response.setVideoDetails(details);
        return response;
    }

    @Test
    @DisplayName("Should fail without a video id and never call upstream")
    void testNoVideoId() throws InterruptedException {
        JobSnapshot job = finishedJob(3600.0);
        job.setVideoId(null);

        assertEquals(HealthCheckResult.HEALTHCHECK_FAILURE, healthCheckService.check(job));
        verifyNoInteractions(playerClient);
    }

    @Test
    @DisplayName("Should be indeterminate with several manifests or no muxed length")
    void testIndeterminate() throws InterruptedException {
        assertEquals(HealthCheckResult.STREAM_LENGTH_INDETERMINATE, healthCheckService.check(finishedJob(10.0, 20.0)));
        assertEquals(HealthCheckResult.STREAM_LENGTH_INDETERMINATE, healthCheckService.check(finishedJob()));
        assertEquals(HealthCheckResult.STREAM_LENGTH_INDETERMINATE, healthCheckService.check(finishedJob((Double) null)));
        verifyNoInteractions(playerClient);
    }

    @Test
    @DisplayName("Should fail when upstream gives no usable answer")
    void testUpstreamFailure() throws InterruptedException {
        when(playerClient.fetchPlayerResponse(VIDEO_ID, false)).thenReturn(null);
        assertEquals(HealthCheckResult.HEALTHCHECK_FAILURE, healthCheckService.check(finishedJob(3600.0)));

        PlayerResponse noDetails = response("OK", "3600", true);
        noDetails.setVideoDetails(null);
        when(playerClient.fetchPlayerResponse(VIDEO_ID, false)).thenReturn(noDetails);
        assertEquals(HealthCheckResult.HEALTHCHECK_FAILURE, healthCheckService.check(finishedJob(3600.0)));

        PlayerResponse noPlayability = response("OK", "3600", true);
        noPlayability.setPlayabilityStatus(null);
        when(playerClient.fetchPlayerResponse(VIDEO_ID, false)).thenReturn(noPlayability);
        assertEquals(HealthCheckResult.HEALTHCHECK_FAILURE, healthCheckService.check(finishedJob(3600.0)));
    }

    @Test
    @DisplayName("Should report videos behind a login as unavailable")
    void testLoginRequired() throws InterruptedException {
        when(playerClient.fetchPlayerResponse(VIDEO_ID, false)).thenReturn(response("LOGIN_REQUIRED", "3600", true));

        assertEquals(HealthCheckResult.VIDEO_UNAVAILABLE, healthCheckService.check(finishedJob(3600.0)));
    }

    @Test
    @DisplayName("Should accept lengths within a second of upstream")
    void testMatchingLength() throws InterruptedException {
        when(playerClient.fetchPlayerResponse(VIDEO_ID, false)).thenReturn(response("OK", "3600", true));

        assertEquals(HealthCheckResult.OK, healthCheckService.check(finishedJob(3600.8)));
        verify(playerClient).fetchPlayerResponse(VIDEO_ID, false);
    }

    @Test
    @DisplayName("Should flag archives whose length differs from upstream")
    void testLengthDiffers() throws InterruptedException {
        when(playerClient.fetchPlayerResponse(VIDEO_ID, false)).thenReturn(response("OK", "3600", true));

        assertEquals(HealthCheckResult.STREAM_LENGTH_DIFFERS, healthCheckService.check(finishedJob(1800.0)));
    }

    @Test
    @DisplayName("Should accept a differing length while upstream is still processing the broadcast")
    void testUpstreamStillProcessing() throws InterruptedException {
        PlayerResponse response = response("OK", "1800", true);
        LiveBroadcastDetails broadcast = new LiveBroadcastDetails();
        OffsetDateTime start = OffsetDateTime.of(2024, 11, 20, 12, 0, 0, 0, ZoneOffset.UTC);
        broadcast.setStartTimestamp(start);
        broadcast.setEndTimestamp(start.plusHours(1));
        response.setLiveBroadcastDetails(broadcast);
        when(playerClient.fetchPlayerResponse(VIDEO_ID, false)).thenReturn(response);

        assertEquals(HealthCheckResult.OK, healthCheckService.check(finishedJob(3600.0)));
    }

    @Test
    @DisplayName("Should not compare lengths of regular uploads")
    void testNonLiveContent() throws InterruptedException {
        when(playerClient.fetchPlayerResponse(VIDEO_ID, false)).thenReturn(response("OK", "60", false));

        assertEquals(HealthCheckResult.OK, healthCheckService.check(finishedJob(3600.0)));
    }
}
