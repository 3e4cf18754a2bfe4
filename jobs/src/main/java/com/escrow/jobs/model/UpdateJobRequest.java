package com.escrow.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Request record for editing an Open job. Title, description and deadline are replaced;
 * additionalValue, when positive, is added to the escrow.
 */
public record UpdateJobRequest(
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("deadline") String deadline,
    @JsonProperty("additionalValue") BigDecimal additionalValue) {

  public Instant parsedDeadline() {
    return deadline == null || deadline.isBlank() ? null : Instant.parse(deadline.trim());
  }
}
