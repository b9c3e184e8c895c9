package com.example.slotnotifier.exception;

import lombok.Getter;

/**
 * Exception for a job store write or delete that did not go through
 */
@Getter
public class JobPersistenceException extends RuntimeException {

    private final String jobId;

    public JobPersistenceException(String jobId, String operation, Throwable cause) {
        super(String.format("Failed to %s job %s: %s", operation, jobId, cause.getMessage()), cause);
        this.jobId = jobId;
    }
}
