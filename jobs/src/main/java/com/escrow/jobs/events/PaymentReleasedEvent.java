package com.escrow.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/** Event record for PaymentReleased audit entries */
public record PaymentReleasedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") long jobId,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("releasedAt") String releasedAt)
    implements LedgerEvent {

  public static final String TYPE = "PaymentReleased";

  public PaymentReleasedEvent(long jobId, BigDecimal amount, String releasedAt) {
    this(TYPE, jobId, amount, releasedAt);
  }
}
