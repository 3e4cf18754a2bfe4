package com.escrow.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Event record for WorkRejected audit entries */
public record WorkRejectedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") long jobId,
    @JsonProperty("rejectedAt") String rejectedAt)
    implements LedgerEvent {

  public static final String TYPE = "WorkRejected";

  public WorkRejectedEvent(long jobId, String rejectedAt) {
    this(TYPE, jobId, rejectedAt);
  }
}
