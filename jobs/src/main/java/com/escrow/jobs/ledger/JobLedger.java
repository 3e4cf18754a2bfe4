package com.escrow.jobs.ledger;

import com.escrow.jobs.access.Authorizer;
import com.escrow.jobs.access.Role;
import com.escrow.jobs.entity.JobEntity;
import com.escrow.jobs.entity.JobStatus;
import com.escrow.jobs.events.AuditLog;
import com.escrow.jobs.events.JobCancelledEvent;
import com.escrow.jobs.events.JobPostedEvent;
import com.escrow.jobs.events.JobUpdatedEvent;
import com.escrow.jobs.events.PaymentReleasedEvent;
import com.escrow.jobs.events.WorkRejectedEvent;
import com.escrow.jobs.events.WorkSubmittedEvent;
import com.escrow.jobs.exceptions.EmptyFieldException;
import com.escrow.jobs.exceptions.InvalidDeadlineException;
import com.escrow.jobs.exceptions.JobLedgerException;
import com.escrow.jobs.exceptions.JobNotFoundException;
import com.escrow.jobs.exceptions.JobNotOpenException;
import com.escrow.jobs.exceptions.NoValueDepositedException;
import com.escrow.jobs.exceptions.NoWorkSubmittedException;
import com.escrow.jobs.exceptions.TransferFailedException;
import com.escrow.jobs.exceptions.UnauthorizedException;
import com.escrow.jobs.payment.EscrowDeposit;
import com.escrow.jobs.payment.TransferReference;
import com.escrow.jobs.payment.ValueTransfer;
import com.escrow.jobs.store.JobStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Escrowed job lifecycle: Open → Submitted → Completed, Submitted → Open on rejection, and
 * Open → Cancelled. Completed and Cancelled are terminal and hold no escrow.
 *
 * <p>Every operation checks the caller's role first, then validates before it mutates, so a
 * rejected call leaves no trace. Deposits are collected from the client's account before the
 * job record is written and handed back if that write fails. Operations are serialized on the
 * ledger instance. The two
 * value-moving operations ({@link #cancelJob} and {@link #approveWork}) commit the record before
 * calling the transfer, run under a shared non-reentrant guard, and restore the pre-call record
 * if the transfer fails.
 */
public class JobLedger {

  private static final Logger log = LoggerFactory.getLogger(JobLedger.class);

  private final Authorizer authorizer;
  private final JobStore jobStore;
  private final EscrowDeposit escrowDeposit;
  private final ValueTransfer valueTransfer;
  private final AuditLog auditLog;
  private final Clock clock;
  private final ReentrancyGuard guard = new ReentrancyGuard();

  public JobLedger(
      Authorizer authorizer,
      JobStore jobStore,
      EscrowDeposit escrowDeposit,
      ValueTransfer valueTransfer,
      AuditLog auditLog,
      Clock clock) {
    this.authorizer = authorizer;
    this.jobStore = jobStore;
    this.escrowDeposit = escrowDeposit;
    this.valueTransfer = valueTransfer;
    this.auditLog = auditLog;
    this.clock = clock;
  }

  public Authorizer authorizer() {
    return authorizer;
  }

  /**
   * Posts a new Open job funded by {@code depositedValue}, taken from the caller's account.
   *
   * @return the allocated job id
   */
  public synchronized long postJob(
      String callerId, String title, String description, Instant deadline, BigDecimal depositedValue)
      throws JobLedgerException {
    authorizer.requireRole(callerId, Role.CLIENT);
    Instant now = clock.instant();
    validateMetadata(title, deadline, now);
    if (depositedValue == null || depositedValue.signum() <= 0) {
      throw new NoValueDepositedException("A positive deposit is required to post a job");
    }
    String depositReference = collectDeposit(callerId, depositedValue);

    JobEntity job;
    try {
      job = JobEntity.builder()
          .jobId(jobStore.nextJobId())
          .clientId(callerId)
          .status(JobStatus.OPEN)
          .title(title)
          .description(description == null ? "" : description)
          .amount(depositedValue)
          .deadline(deadline)
          .proofHash("")
          .createdAt(now)
          .updatedAt(now)
          .version(1)
          .build();
      jobStore.create(job);
    } catch (RuntimeException e) {
      returnDeposit(depositReference, callerId, depositedValue, e);
      throw e;
    }

    log.info("JobPosted jobId={} clientId={} amount={}", job.jobId(), callerId, depositedValue.toPlainString());
    auditLog.publish(new JobPostedEvent(job.jobId(), callerId, depositedValue, now.toString()));
    return job.jobId();
  }

  /**
   * Replaces title, description and deadline of an Open job and adds {@code additionalValue},
   * taken from the caller's account, to its escrow. A null or zero additional value leaves the
   * amount unchanged.
   */
  public synchronized JobEntity updateJob(
      String callerId,
      long jobId,
      String title,
      String description,
      Instant deadline,
      BigDecimal additionalValue)
      throws JobLedgerException {
    authorizer.requireRole(callerId, Role.CLIENT);
    Instant now = clock.instant();
    validateMetadata(title, deadline, now);
    if (additionalValue != null && additionalValue.signum() < 0) {
      throw new NoValueDepositedException("Additional deposit cannot be negative");
    }
    JobEntity job = findOwnedJob(callerId, jobId);
    requireOpen(job);

    boolean topUp = additionalValue != null && additionalValue.signum() > 0;
    BigDecimal amount = topUp ? job.amount().add(additionalValue) : job.amount();
    String depositReference = topUp ? collectDeposit(callerId, additionalValue) : null;

    JobEntity updated = job.toBuilder()
        .title(title)
        .description(description == null ? "" : description)
        .deadline(deadline)
        .amount(amount)
        .updatedAt(now)
        .version(job.version() + 1)
        .build();
    try {
      jobStore.update(updated);
    } catch (RuntimeException e) {
      if (topUp) {
        returnDeposit(depositReference, callerId, additionalValue, e);
      }
      throw e;
    }

    log.info("JobUpdated jobId={} amount={}", jobId, amount.toPlainString());
    auditLog.publish(new JobUpdatedEvent(jobId, now.toString()));
    return updated;
  }

  /** Cancels an Open job and refunds its escrow to the client. */
  public synchronized JobEntity cancelJob(String callerId, long jobId) throws JobLedgerException {
    return guard.run("cancelJob", () -> {
      authorizer.requireRole(callerId, Role.CLIENT);
      JobEntity job = findOwnedJob(callerId, jobId);
      requireOpen(job);

      Instant now = clock.instant();
      BigDecimal refundAmount = job.amount();
      JobEntity cancelled = job.toBuilder()
          .status(JobStatus.CANCELLED)
          .amount(BigDecimal.ZERO)
          .updatedAt(now)
          .version(job.version() + 1)
          .build();

      StagedTransition transition = StagedTransition.commit(
          jobStore, job, cancelled, new JobCancelledEvent(jobId, refundAmount, now.toString()));
      if (refundAmount.signum() > 0) {
        payOut(transition, job.clientId(), refundAmount);
      }
      transition.complete(auditLog);

      log.info("JobCancelled jobId={} refundAmount={}", jobId, refundAmount.toPlainString());
      return cancelled;
    });
  }

  /** Claims an Open job for the calling freelancer with an opaque proof reference. */
  public synchronized JobEntity submitWork(String callerId, long jobId, String proofHash)
      throws JobLedgerException {
    authorizer.requireRole(callerId, Role.FREELANCER);
    JobEntity job = findJob(jobId);
    requireOpen(job);
    Instant now = clock.instant();
    if (now.isAfter(job.deadline())) {
      throw new InvalidDeadlineException("Submission deadline " + job.deadline() + " has passed");
    }
    if (proofHash == null || proofHash.isEmpty()) {
      throw new EmptyFieldException("Proof reference is required");
    }

    JobEntity submitted = job.toBuilder()
        .freelancerId(callerId)
        .proofHash(proofHash)
        .status(JobStatus.SUBMITTED)
        .updatedAt(now)
        .version(job.version() + 1)
        .build();
    jobStore.update(submitted);

    log.info("WorkSubmitted jobId={} freelancerId={}", jobId, callerId);
    auditLog.publish(new WorkSubmittedEvent(jobId, callerId, proofHash, now.toString()));
    return submitted;
  }

  /**
   * Accepts the submission and pays the whole escrow to the freelancer. The freelancer stays on
   * the completed record as the payee.
   */
  public synchronized JobEntity approveWork(String callerId, long jobId) throws JobLedgerException {
    return guard.run("approveWork", () -> {
      authorizer.requireRole(callerId, Role.CLIENT);
      JobEntity job = findOwnedJob(callerId, jobId);
      requireSubmitted(job);

      Instant now = clock.instant();
      String freelancerId = job.freelancerId();
      BigDecimal payment = job.amount();
      JobEntity completed = job.toBuilder()
          .status(JobStatus.COMPLETED)
          .amount(BigDecimal.ZERO)
          .updatedAt(now)
          .version(job.version() + 1)
          .build();

      StagedTransition transition = StagedTransition.commit(
          jobStore, job, completed, new PaymentReleasedEvent(jobId, payment, now.toString()));
      payOut(transition, freelancerId, payment);
      transition.complete(auditLog);

      log.info("PaymentReleased jobId={} freelancerId={} amount={}", jobId, freelancerId, payment.toPlainString());
      return completed;
    });
  }

  /** Turns a submission down and reopens the job; the escrow stays in place. */
  public synchronized JobEntity rejectWork(String callerId, long jobId) throws JobLedgerException {
    authorizer.requireRole(callerId, Role.CLIENT);
    JobEntity job = findOwnedJob(callerId, jobId);
    requireSubmitted(job);

    Instant now = clock.instant();
    JobEntity reopened = job.toBuilder()
        .freelancerId(null)
        .proofHash("")
        .status(JobStatus.OPEN)
        .updatedAt(now)
        .version(job.version() + 1)
        .build();
    jobStore.update(reopened);

    log.info("WorkRejected jobId={} freelancerId={}", jobId, job.freelancerId());
    auditLog.publish(new WorkRejectedEvent(jobId, now.toString()));
    return reopened;
  }

  public synchronized JobEntity getJob(long jobId) throws JobNotFoundException {
    return findJob(jobId);
  }

  /** Number of ids allocated so far. */
  public synchronized long jobCount() {
    return jobStore.lastJobId();
  }

  /**
   * Pays out under the job's payout reference, so a retry after an ambiguous failure cannot pay
   * twice. A failed rollback is attached to the thrown exception as suppressed.
   */
  private void payOut(StagedTransition transition, String recipientId, BigDecimal amount)
      throws TransferFailedException {
    long jobId = transition.committed().jobId();
    Throwable cause = null;
    boolean transferred;
    try {
      transferred = valueTransfer.transfer(TransferReference.payout(jobId), recipientId, amount);
    } catch (RuntimeException e) {
      transferred = false;
      cause = e;
    }
    if (!transferred) {
      log.warn("TransferFailed jobId={} recipientId={} amount={}", jobId, recipientId, amount.toPlainString());
      TransferFailedException failure = new TransferFailedException(recipientId, amount, cause);
      try {
        transition.rollback();
      } catch (RuntimeException e) {
        failure.addSuppressed(e);
      }
      throw failure;
    }
  }

  private String collectDeposit(String payerId, BigDecimal amount) throws NoValueDepositedException {
    String reference = TransferReference.newDeposit();
    boolean collected;
    try {
      collected = escrowDeposit.collect(reference, payerId, amount);
    } catch (RuntimeException e) {
      log.error("Deposit of {} from {} failed", amount.toPlainString(), payerId, e);
      collected = false;
    }
    if (!collected) {
      throw new NoValueDepositedException(
          "Deposit of " + amount.toPlainString() + " could not be collected from " + payerId);
    }
    return reference;
  }

  private void returnDeposit(String depositReference, String payerId, BigDecimal amount, RuntimeException failure) {
    boolean returned;
    try {
      returned = valueTransfer.transfer(TransferReference.refundOf(depositReference), payerId, amount);
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
      returned = false;
    }
    if (returned) {
      log.warn("DepositReturned reference={} payerId={} amount={}", depositReference, payerId, amount.toPlainString());
    } else {
      log.error("DepositStranded reference={} payerId={} amount={}", depositReference, payerId, amount.toPlainString());
    }
  }

  private static void validateMetadata(String title, Instant deadline, Instant now)
      throws EmptyFieldException, InvalidDeadlineException {
    if (title == null || title.isEmpty()) {
      throw new EmptyFieldException("Title is required");
    }
    if (deadline == null || deadline.equals(Instant.EPOCH)) {
      throw new EmptyFieldException("Deadline is required");
    }
    if (!deadline.isAfter(now)) {
      throw new InvalidDeadlineException("Deadline " + deadline + " must be in the future");
    }
  }

  private JobEntity findJob(long jobId) throws JobNotFoundException {
    return jobStore.findById(jobId)
        .orElseThrow(() -> new JobNotFoundException("Job " + jobId + " not found"));
  }

  private JobEntity findOwnedJob(String callerId, long jobId)
      throws JobNotFoundException, UnauthorizedException {
    JobEntity job = findJob(jobId);
    if (!job.isOwnedBy(callerId)) {
      throw new UnauthorizedException("Job " + jobId + " does not belong to you");
    }
    return job;
  }

  private static void requireOpen(JobEntity job) throws JobNotOpenException {
    if (job.status() != JobStatus.OPEN) {
      throw new JobNotOpenException(
          "Job " + job.jobId() + " is not open (current: " + job.status().value() + ")");
    }
  }

  private static void requireSubmitted(JobEntity job) throws NoWorkSubmittedException {
    if (job.status() != JobStatus.SUBMITTED) {
      throw new NoWorkSubmittedException(
          "Job " + job.jobId() + " has no submitted work (current: " + job.status().value() + ")");
    }
  }
}
