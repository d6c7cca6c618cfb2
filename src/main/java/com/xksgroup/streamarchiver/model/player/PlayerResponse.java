package com.xksgroup.streamarchiver.model.player;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * The subset of the upstream player response used for scheduling and health checks.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlayerResponse {

    private VideoDetails videoDetails;
    private PlayabilityStatus playabilityStatus;
    private LiveBroadcastDetails liveBroadcastDetails;

    // microformat.playerMicroformatRenderer.liveBroadcastDetails
    @JsonProperty("microformat")
    void unpackMicroformat(JsonNode microformat) {
        JsonNode details = microformat.path("playerMicroformatRenderer").path("liveBroadcastDetails");
        if (!details.isObject()) {
            return;
        }
        LiveBroadcastDetails broadcast = new LiveBroadcastDetails();
        broadcast.setStartTimestamp(parseTimestamp(details.path("startTimestamp")));
        broadcast.setEndTimestamp(parseTimestamp(details.path("endTimestamp")));
        broadcast.setLiveNow(details.path("isLiveNow").asBoolean(false));
        this.liveBroadcastDetails = broadcast;
    }

    private static OffsetDateTime parseTimestamp(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(node.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
