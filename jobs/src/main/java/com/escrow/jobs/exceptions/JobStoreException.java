package com.escrow.jobs.exceptions;

/**
 * Unchecked failure of the backing store (network, throttling, missing table)
 */
public class JobStoreException extends RuntimeException {
    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
