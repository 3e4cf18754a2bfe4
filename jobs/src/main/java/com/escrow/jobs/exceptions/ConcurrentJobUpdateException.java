package com.escrow.jobs.exceptions;

/**
 * Exception thrown when a job record changed between read and conditional write
 */
public class ConcurrentJobUpdateException extends RuntimeException {
    public ConcurrentJobUpdateException(String message) {
        super(message);
    }

    public ConcurrentJobUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
