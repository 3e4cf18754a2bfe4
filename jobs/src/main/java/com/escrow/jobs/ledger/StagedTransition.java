package com.escrow.jobs.ledger;

import com.escrow.jobs.entity.JobEntity;
import com.escrow.jobs.events.AuditLog;
import com.escrow.jobs.events.LedgerEvent;
import com.escrow.jobs.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A job transition whose record is already written but whose audit event is held back until the
 * external transfer has succeeded.
 *
 * <p>Phase 1 ({@link #commit}) stores the mutated record. Phase 2 either {@link #complete}s,
 * publishing the staged event, or {@link #rollback}s, writing the pre-call snapshot back under a
 * fresh version and dropping the event.
 */
final class StagedTransition {

  private static final Logger log = LoggerFactory.getLogger(StagedTransition.class);

  private final JobStore jobStore;
  private final JobEntity snapshot;
  private final JobEntity committed;
  private final LedgerEvent stagedEvent;

  private StagedTransition(JobStore jobStore, JobEntity snapshot, JobEntity committed, LedgerEvent stagedEvent) {
    this.jobStore = jobStore;
    this.snapshot = snapshot;
    this.committed = committed;
    this.stagedEvent = stagedEvent;
  }

  static StagedTransition commit(JobStore jobStore, JobEntity snapshot, JobEntity committed, LedgerEvent event) {
    if (committed.status().isTerminal() && committed.amount().signum() != 0) {
      throw new IllegalStateException(
          "Job " + committed.jobId() + " cannot enter " + committed.status().value() + " while holding escrow");
    }
    jobStore.update(committed);
    return new StagedTransition(jobStore, snapshot, committed, event);
  }

  JobEntity committed() {
    return committed;
  }

  void complete(AuditLog auditLog) {
    auditLog.publish(stagedEvent);
  }

  void rollback() {
    long currentVersion = jobStore.findById(committed.jobId())
        .map(JobEntity::version)
        .orElse(committed.version());
    JobEntity restored = snapshot.toBuilder().version(currentVersion + 1).build();
    try {
      jobStore.update(restored);
      log.warn("TransitionRolledBack jobId={} status={} amount={}",
          restored.jobId(), restored.status().value(), restored.amount().toPlainString());
    } catch (RuntimeException e) {
      log.error("RollbackFailed jobId={}", restored.jobId(), e);
      throw e;
    }
  }
}
