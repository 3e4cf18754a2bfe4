package com.escrow.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Event record for JobUpdated audit entries */
public record JobUpdatedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") long jobId,
    @JsonProperty("updatedAt") String updatedAt)
    implements LedgerEvent {

  public static final String TYPE = "JobUpdated";

  public JobUpdatedEvent(long jobId, String updatedAt) {
    this(TYPE, jobId, updatedAt);
  }
}
