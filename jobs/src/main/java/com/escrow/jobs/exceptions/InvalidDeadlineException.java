package com.escrow.jobs.exceptions;

/**
 * Exception thrown when a deadline is not in the future, or a submission arrives after it
 */
public class InvalidDeadlineException extends JobLedgerException {
    public InvalidDeadlineException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "InvalidDeadline";
    }
}
