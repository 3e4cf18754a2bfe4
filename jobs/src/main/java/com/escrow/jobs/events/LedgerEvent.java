package com.escrow.jobs.events;

/** An entry of the append-only audit stream */
public interface LedgerEvent {

  /** Name of the event, also used as the EventBridge detail type. */
  String eventType();

  long jobId();
}
