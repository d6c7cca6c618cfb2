package com.xksgroup.streamarchiver.exception;

/**
 * The requested operation is not allowed in the job's current state.
 */
public class JobStateException extends RuntimeException {

    public JobStateException(String message) {
        super(message);
    }
}
