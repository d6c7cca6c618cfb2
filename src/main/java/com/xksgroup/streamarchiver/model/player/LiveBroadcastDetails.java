package com.xksgroup.streamarchiver.model.player;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
public class LiveBroadcastDetails {

    private OffsetDateTime startTimestamp;
    private OffsetDateTime endTimestamp;
    private boolean liveNow;

    /**
     * Broadcast length as reported by its start and end timestamps, in whole seconds;
     * {@code null} while either end is missing.
     */
    public Long getEstimatedDurationSeconds() {
        if (startTimestamp == null || endTimestamp == null) {
            return null;
        }
        return Duration.between(startTimestamp, endTimestamp).getSeconds();
    }
}
