package com.escrow.jobs.store;

import com.escrow.jobs.entity.JobEntity;
import com.escrow.jobs.exceptions.ConcurrentJobUpdateException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Process-local job registry */
public class InMemoryJobStore implements JobStore {

  private final Map<Long, JobEntity> jobs = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  @Override
  public long nextJobId() {
    return sequence.incrementAndGet();
  }

  @Override
  public long lastJobId() {
    return sequence.get();
  }

  @Override
  public Optional<JobEntity> findById(long jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  @Override
  public void create(JobEntity job) {
    if (jobs.putIfAbsent(job.jobId(), job) != null) {
      throw new ConcurrentJobUpdateException("Job " + job.jobId() + " already exists");
    }
  }

  @Override
  public void update(JobEntity job) {
    jobs.compute(job.jobId(), (id, stored) -> {
      if (stored == null || stored.version() != job.version() - 1) {
        throw new ConcurrentJobUpdateException("Job " + id + " changed since it was read");
      }
      return job;
    });
  }
}
