package com.escrow.jobs.exceptions;

/**
 * Exception thrown when a required field (title, deadline or proof reference) is empty
 */
public class EmptyFieldException extends JobLedgerException {
    public EmptyFieldException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "EmptyField";
    }
}
