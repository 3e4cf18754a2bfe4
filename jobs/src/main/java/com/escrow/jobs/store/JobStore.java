package com.escrow.jobs.store;

import com.escrow.jobs.entity.JobEntity;
import java.util.Optional;

/**
 * Key-value registry of job records.
 *
 * <p>Writes are version-conditional: {@link #create} succeeds only when no record exists for the
 * id, {@link #update} only when the stored version is exactly one below the new record's version.
 * Either violation raises {@link com.escrow.jobs.exceptions.ConcurrentJobUpdateException}.
 */
public interface JobStore {

  /** Allocates the next job id. Ids start at 1 and are never handed out twice. */
  long nextJobId();

  /** Highest id allocated so far, 0 when the registry is empty. */
  long lastJobId();

  Optional<JobEntity> findById(long jobId);

  void create(JobEntity job);

  void update(JobEntity job);
}
