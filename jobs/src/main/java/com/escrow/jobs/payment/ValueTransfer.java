package com.escrow.jobs.payment;

import java.math.BigDecimal;

/**
 * Moves escrowed value out of custody to a recipient.
 *
 * <p>The {@code reference} identifies the movement: a reference that was already applied is
 * never applied again, and a repeat with the same recipient and amount reports success.
 * Implementations may call back into the ledger before returning. Returning {@code false} or
 * throwing both count as failure and make the ledger roll the calling operation back.
 */
public interface ValueTransfer {

  boolean transfer(String reference, String recipientId, BigDecimal amount);
}
