package com.xksgroup.streamarchiver.model;

import com.xksgroup.streamarchiver.config.ArchiverProperties.ChannelMonitorConfig;

import java.util.Set;

/**
 * A feed entry that matched at least one of its channel's rules during one poll cycle.
 */
public record FeedItemMatch(
        ChannelMonitorConfig channel,
        String url,
        String videoId,
        String author,
        Set<String> matchingTerms
) {
    /**
     * Configured channel name if there is one, otherwise the feed's author.
     */
    public String displayAuthor() {
        return channel.getName() != null && !channel.getName().isBlank() ? channel.getName() : author;
    }
}
