package com.escrow.jobs.exceptions;

/**
 * Exception thrown when no job exists for the requested id
 */
public class JobNotFoundException extends JobLedgerException {
    public JobNotFoundException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "JobNotFound";
    }
}
