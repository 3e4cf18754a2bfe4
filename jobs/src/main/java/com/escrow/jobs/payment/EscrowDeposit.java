package com.escrow.jobs.payment;

import java.math.BigDecimal;

/**
 * Takes value from a payer into custody. Returns {@code false} when the payer cannot cover the
 * amount; nothing is taken in that case.
 */
public interface EscrowDeposit {

  boolean collect(String reference, String payerId, BigDecimal amount);
}
