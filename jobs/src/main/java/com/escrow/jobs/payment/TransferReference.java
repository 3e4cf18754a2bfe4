package com.escrow.jobs.payment;

import java.util.UUID;

/** Reference keys for custody movements */
public final class TransferReference {

  private TransferReference() {}

  /** A job pays out once, on approval or on cancellation. */
  public static String payout(long jobId) {
    return "job-" + jobId + "-payout";
  }

  public static String newDeposit() {
    return "deposit-" + UUID.randomUUID();
  }

  /** Returns a deposit whose job write never landed. */
  public static String refundOf(String depositReference) {
    return depositReference + "-refund";
  }
}
