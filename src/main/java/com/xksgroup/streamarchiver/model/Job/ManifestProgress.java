package com.xksgroup.streamarchiver.model.Job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Download and mux counters for a single stream manifest.
 * Fragment counters only move forward for the lifetime of the manifest.
 */
@Data
@NoArgsConstructor
public class ManifestProgress {

    private long videoSeq;
    private long audioSeq;
    private long maxSeq;
    private long totalDownloaded;

    // Mux progress; unknown until the muxer reports in
    private Long outputSize;
    private Double outputTimeSeconds;

    // Fragment position at the first update, used for the rate estimate
    private long firstSeq;
    private Instant firstUpdate;
    private Instant lastUpdate;

    public void recordFragment(MediaKind mediaKind, long currentFragment, long maxFragments,
                               long fragmentSize, Instant now) {
        if (firstUpdate == null) {
            firstUpdate = now;
            firstSeq = currentFragment;
        }
        maxSeq = Math.max(maxSeq, maxFragments);
        if (mediaKind == MediaKind.AUDIO) {
            audioSeq = Math.max(audioSeq, currentFragment);
        } else if (mediaKind == MediaKind.VIDEO) {
            videoSeq = Math.max(videoSeq, currentFragment);
        }
        totalDownloaded += Math.max(0, fragmentSize);
        lastUpdate = now;
    }

    public void recordMuxProgress(Double outTimeSeconds, Long totalSize) {
        if (outTimeSeconds != null) {
            this.outputTimeSeconds = outTimeSeconds;
        }
        if (totalSize != null) {
            this.outputSize = totalSize;
        }
    }

    @JsonIgnore
    public long getCurrentSeq() {
        return Math.max(videoSeq, audioSeq);
    }

    /**
     * Remaining fragments divided by the observed fragment rate.
     *
     * @return the estimate, or {@code null} before any measurable progress
     */
    @JsonIgnore
    public Duration getEstimatedTimeRemaining() {
        if (firstUpdate == null || lastUpdate == null) {
            return null;
        }
        double elapsedSeconds = Duration.between(firstUpdate, lastUpdate).toMillis() / 1000.0;
        long fragmentsDone = getCurrentSeq() - firstSeq;
        if (elapsedSeconds <= 0 || fragmentsDone <= 0) {
            return null;
        }
        double fragmentsPerSecond = fragmentsDone / elapsedSeconds;
        long remaining = Math.max(0, maxSeq - getCurrentSeq());
        return Duration.ofMillis(Math.round(remaining / fragmentsPerSecond * 1000));
    }

    public ManifestProgress copy() {
        ManifestProgress copy = new ManifestProgress();
        copy.videoSeq = videoSeq;
        copy.audioSeq = audioSeq;
        copy.maxSeq = maxSeq;
        copy.totalDownloaded = totalDownloaded;
        copy.outputSize = outputSize;
        copy.outputTimeSeconds = outputTimeSeconds;
        copy.firstSeq = firstSeq;
        copy.firstUpdate = firstUpdate;
        copy.lastUpdate = lastUpdate;
        return copy;
    }
}
