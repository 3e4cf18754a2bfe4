package com.escrow.jobs.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Job record held in the registry.
 *
 * <p>{@code freelancerId} is null unless the job is Submitted (or the reserved InReview state);
 * {@code proofHash} is the empty string when no proof is attached. {@code version} increases by
 * one with every stored write and backs the store's optimistic concurrency check.
 */
public record JobEntity(
    long jobId,
    String clientId,
    String freelancerId,
    JobStatus status,
    String title,
    String description,
    BigDecimal amount,
    Instant deadline,
    String proofHash,
    Instant createdAt,
    Instant updatedAt,
    long version) {

  public Optional<String> freelancer() {
    return Optional.ofNullable(freelancerId);
  }

  public boolean isOwnedBy(String callerId) {
    return clientId.equals(callerId);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .jobId(jobId)
        .clientId(clientId)
        .freelancerId(freelancerId)
        .status(status)
        .title(title)
        .description(description)
        .amount(amount)
        .deadline(deadline)
        .proofHash(proofHash)
        .createdAt(createdAt)
        .updatedAt(updatedAt)
        .version(version);
  }

  public static class Builder {
    private long jobId;
    private String clientId;
    private String freelancerId;
    private JobStatus status = JobStatus.OPEN;
    private String title;
    private String description;
    private BigDecimal amount = BigDecimal.ZERO;
    private Instant deadline;
    private String proofHash = "";
    private Instant createdAt;
    private Instant updatedAt;
    private long version;

    public Builder jobId(long jobId) {
      this.jobId = jobId;
      return this;
    }

    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder freelancerId(String freelancerId) {
      this.freelancerId = freelancerId;
      return this;
    }

    public Builder status(JobStatus status) {
      this.status = status;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder amount(BigDecimal amount) {
      this.amount = amount;
      return this;
    }

    public Builder deadline(Instant deadline) {
      this.deadline = deadline;
      return this;
    }

    public Builder proofHash(String proofHash) {
      this.proofHash = proofHash;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder version(long version) {
      this.version = version;
      return this;
    }

    public JobEntity build() {
      return new JobEntity(
          jobId,
          clientId,
          freelancerId,
          status,
          title,
          description,
          amount,
          deadline,
          proofHash == null ? "" : proofHash,
          createdAt,
          updatedAt,
          version);
    }
  }
}
