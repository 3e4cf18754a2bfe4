package com.escrow.jobs.events;

/**
 * Append-only sink for ledger events. Publishing happens after the emitting operation has
 * committed, so implementations must not throw: a lost audit entry never undoes a committed
 * transition.
 */
public interface AuditLog {

  void publish(LedgerEvent event);
}
