package com.escrow.jobs.exceptions;

/**
 * Exception thrown when approving or rejecting a job that has no submission
 */
public class NoWorkSubmittedException extends JobLedgerException {
    public NoWorkSubmittedException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "NoWorkSubmitted";
    }
}
