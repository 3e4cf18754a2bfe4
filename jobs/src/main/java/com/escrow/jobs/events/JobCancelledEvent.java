package com.escrow.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/** Event record for JobCancelled audit entries; refundAmount is what the client gets back */
public record JobCancelledEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") long jobId,
    @JsonProperty("refundAmount") BigDecimal refundAmount,
    @JsonProperty("cancelledAt") String cancelledAt)
    implements LedgerEvent {

  public static final String TYPE = "JobCancelled";

  public JobCancelledEvent(long jobId, BigDecimal refundAmount, String cancelledAt) {
    this(TYPE, jobId, refundAmount, cancelledAt);
  }
}
