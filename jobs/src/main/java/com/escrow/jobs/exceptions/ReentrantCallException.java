package com.escrow.jobs.exceptions;

/**
 * Exception thrown when a value-moving operation is entered again while it is still executing,
 * typically from inside a transfer callback
 */
public class ReentrantCallException extends JobLedgerException {
    public ReentrantCallException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "ReentrantCall";
    }
}
