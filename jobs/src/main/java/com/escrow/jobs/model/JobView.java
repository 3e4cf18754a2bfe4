package com.escrow.jobs.model;

import com.escrow.jobs.entity.JobEntity;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/** Response record exposing a job record over HTTP */
public record JobView(
    @JsonProperty("jobId") long jobId,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("freelancerId") String freelancerId,
    @JsonProperty("status") String status,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("deadline") String deadline,
    @JsonProperty("proofHash") String proofHash,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("updatedAt") String updatedAt) {

  public static JobView from(JobEntity job) {
    return new JobView(
        job.jobId(),
        job.clientId(),
        job.freelancerId(),
        job.status().value(),
        job.title(),
        job.description(),
        job.amount(),
        job.deadline().toString(),
        job.proofHash(),
        job.createdAt().toString(),
        job.updatedAt().toString());
  }
}
