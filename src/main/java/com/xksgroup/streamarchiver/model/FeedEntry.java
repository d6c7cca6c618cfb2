package com.xksgroup.streamarchiver.model;

/**
 * One entry of a channel's upload feed, newest first as served upstream.
 */
public record FeedEntry(
        String title,
        String summary,
        String link,
        String videoId,
        String author
) {}
