package com.xksgroup.streamarchiver.exception;

/**
 * A channel feed could not be fetched or parsed. The channel is retried on the next cycle.
 */
public class FeedFetchException extends RuntimeException {

    public FeedFetchException(String message) {
        super(message);
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
