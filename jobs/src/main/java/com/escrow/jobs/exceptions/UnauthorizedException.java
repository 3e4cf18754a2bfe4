package com.escrow.jobs.exceptions;

/**
 * Exception thrown when the caller lacks the required role or does not own the job
 */
public class UnauthorizedException extends JobLedgerException {
    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "Unauthorized";
    }
}
