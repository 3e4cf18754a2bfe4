package com.escrow.jobs.entity;

/** Lifecycle states of an escrowed job, with the value stored in the jobs table */
public enum JobStatus {
  OPEN("open"),
  SUBMITTED("submitted"),
  // Reserved: no transition produces or consumes it.
  IN_REVIEW("in_review"),
  COMPLETED("completed"),
  CANCELLED("cancelled");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Completed and Cancelled have no outgoing transitions and hold no escrow. */
  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  public static JobStatus fromValue(String value) {
    for (JobStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + value);
  }
}
