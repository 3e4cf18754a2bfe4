package com.escrow.jobs.exceptions;

/**
 * Exception thrown when an operation requires an Open job
 */
public class JobNotOpenException extends JobLedgerException {
    public JobNotOpenException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "JobNotOpen";
    }
}
