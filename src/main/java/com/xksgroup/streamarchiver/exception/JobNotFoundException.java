package com.xksgroup.streamarchiver.exception;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("No job found with ID: " + jobId);
    }
}
