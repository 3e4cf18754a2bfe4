package com.escrow.jobs.exceptions;

/**
 * Exception thrown when a job is posted without a positive deposit
 */
public class NoValueDepositedException extends JobLedgerException {
    public NoValueDepositedException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "NoValueDeposited";
    }
}
