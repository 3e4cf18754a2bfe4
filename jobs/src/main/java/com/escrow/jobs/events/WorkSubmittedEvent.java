package com.escrow.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Event record for WorkSubmitted audit entries */
public record WorkSubmittedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") long jobId,
    @JsonProperty("freelancerId") String freelancerId,
    @JsonProperty("proofHash") String proofHash,
    @JsonProperty("submittedAt") String submittedAt)
    implements LedgerEvent {

  public static final String TYPE = "WorkSubmitted";

  public WorkSubmittedEvent(long jobId, String freelancerId, String proofHash, String submittedAt) {
    this(TYPE, jobId, freelancerId, proofHash, submittedAt);
  }
}
