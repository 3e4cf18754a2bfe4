package com.escrow.jobs.exceptions;

import java.math.BigDecimal;

/**
 * Exception thrown when the external transfer primitive reports failure. By the time it reaches
 * the caller every mutation staged by the operation has been rolled back. If the rollback write
 * itself failed, that failure is attached as suppressed.
 */
public class TransferFailedException extends JobLedgerException {

    public TransferFailedException(String recipientId, BigDecimal amount, Throwable cause) {
        super("Transfer of " + amount + " to " + recipientId + " failed", cause);
    }

    @Override
    public String errorCode() {
        return "TransferFailed";
    }
}
