package com.escrow.jobs.exceptions;

/**
 * Base class for synchronous rejections of a ledger operation. Each subclass names one entry of
 * the error taxonomy through {@link #errorCode()}.
 */
public abstract class JobLedgerException extends Exception {

    protected JobLedgerException(String message) {
        super(message);
    }

    protected JobLedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorCode();
}
