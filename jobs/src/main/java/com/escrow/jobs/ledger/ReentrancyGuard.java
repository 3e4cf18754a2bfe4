package com.escrow.jobs.ledger;

import com.escrow.jobs.exceptions.JobLedgerException;
import com.escrow.jobs.exceptions.ReentrantCallException;
import java.util.concurrent.atomic.AtomicBoolean;

/** Busy flag shared by every value-moving operation of one ledger */
class ReentrancyGuard {

  @FunctionalInterface
  interface GuardedCall<T> {
    T call() throws JobLedgerException;
  }

  private final AtomicBoolean busy = new AtomicBoolean();

  <T> T run(String operation, GuardedCall<T> call) throws JobLedgerException {
    if (!busy.compareAndSet(false, true)) {
      throw new ReentrantCallException(operation + " called while a transfer is in progress");
    }
    try {
      return call.call();
    } finally {
      busy.set(false);
    }
  }
}
