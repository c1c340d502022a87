package com.scholary.diarizer.job;

import java.util.Optional;

/**
 * Keyed storage for job records.
 *
 * <p>Each job owns its own key, so operations on different jobs never interfere. Records expire a
 * fixed time after they are created, whatever their outcome.
 */
public interface JobRecordStore {

  /**
   * Store a new record.
   *
   * @throws JobStoreException if a record with the same id exists or the store is unavailable
   */
  void create(JobRecord record);

  /** Look up a record; empty when unknown or expired. */
  Optional<JobRecord> find(String jobId);

  /**
   * Apply a partial update atomically.
   *
   * @return the record after the update
   * @throws JobStoreException if the record does not exist or the store is unavailable
   * @throws IllegalStateException if the update would move the status backwards
   */
  JobRecord update(String jobId, JobUpdate update);

  /**
   * Remove a record.
   *
   * @return true if a record was removed
   */
  boolean delete(String jobId);
}
