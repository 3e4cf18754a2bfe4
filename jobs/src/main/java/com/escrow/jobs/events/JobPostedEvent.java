package com.escrow.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/** Event record for JobPosted audit entries */
public record JobPostedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") long jobId,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("postedAt") String postedAt)
    implements LedgerEvent {

  public static final String TYPE = "JobPosted";

  public JobPostedEvent(long jobId, String clientId, BigDecimal amount, String postedAt) {
    this(TYPE, jobId, clientId, amount, postedAt);
  }
}
