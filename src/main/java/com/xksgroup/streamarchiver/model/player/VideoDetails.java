package com.xksgroup.streamarchiver.model.player;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VideoDetails {

    private String videoId;
    private String title;
    private String author;
    private String channelId;
    private String lengthSeconds;

    @JsonProperty("isLive")
    private boolean live;

    // Missing upstream means "assume it was a broadcast" so streams are not skipped by accident
    @JsonProperty("isLiveContent")
    private boolean liveContent = true;

    @JsonProperty("isUpcoming")
    private boolean upcoming;

    @JsonProperty("isPostLiveDvr")
    private boolean postLiveDvr;

    private List<Thumbnail> thumbnails = new ArrayList<>();

    @JsonProperty("thumbnail")
    void unpackThumbnail(JsonNode thumbnail) {
        List<Thumbnail> unpacked = new ArrayList<>();
        for (JsonNode node : thumbnail.path("thumbnails")) {
            unpacked.add(new Thumbnail(node.path("url").asText(null),
                    node.path("width").asInt(0),
                    node.path("height").asInt(0)));
        }
        this.thumbnails = unpacked;
    }

    public Long getVideoDurationSeconds() {
        if (lengthSeconds == null || lengthSeconds.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(lengthSeconds.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * URL of the largest thumbnail by width, then height.
     */
    public String getBestThumbnailUrl() {
        return thumbnails.stream()
                .max(Comparator.comparingInt(Thumbnail::width).thenComparingInt(Thumbnail::height))
                .map(Thumbnail::url)
                .orElse(null);
    }

    /**
     * Whether the content is (or is about to be) a broadcast whose fragments can be fetched.
     */
    public boolean isArchivable() {
        return postLiveDvr || upcoming || live;
    }

    public record Thumbnail(String url, int width, int height) {
    }
}
