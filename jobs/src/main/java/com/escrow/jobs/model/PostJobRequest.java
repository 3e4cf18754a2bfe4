package com.escrow.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Request record for posting a new job. The deadline is an ISO-8601 instant; the deposit is the
 * value attached to the call.
 */
public record PostJobRequest(
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("deadline") String deadline,
    @JsonProperty("depositedValue") BigDecimal depositedValue) {

  /** Null when absent, so the ledger reports it as an empty field. */
  public Instant parsedDeadline() {
    return deadline == null || deadline.isBlank() ? null : Instant.parse(deadline.trim());
  }
}
