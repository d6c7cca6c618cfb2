package com.xksgroup.streamarchiver.model.player;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlayabilityStatus {

    public static final String LOGIN_REQUIRED = "LOGIN_REQUIRED";

    private String status;
    private Instant scheduledStartTime;

    // liveStreamability.liveStreamabilityRenderer.offlineSlate.liveStreamOfflineSlateRenderer.scheduledStartTime
    @JsonProperty("liveStreamability")
    void unpackLiveStreamability(JsonNode liveStreamability) {
        JsonNode startTime = liveStreamability.path("liveStreamabilityRenderer")
                .path("offlineSlate")
                .path("liveStreamOfflineSlateRenderer")
                .path("scheduledStartTime");
        if (startTime.isMissingNode() || startTime.isNull()) {
            return;
        }
        try {
            this.scheduledStartTime = Instant.ofEpochSecond(Long.parseLong(startTime.asText().trim()));
        } catch (NumberFormatException e) {
            this.scheduledStartTime = null;
        }
    }

    public boolean isLoginRequired() {
        return LOGIN_REQUIRED.equals(status);
    }
}
