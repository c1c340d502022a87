package com.scholary.diarizer.api;

import com.scholary.diarizer.job.JobRecord;
import com.scholary.diarizer.job.JobStatus;
import java.time.Instant;

/**
 * Response for an accepted submission.
 *
 * <p>Returns the job ID to poll with. The status is normally {@code pending}; it is already
 * {@code failed} when the worker queue was full.
 */
public record AsyncJobResponse(String jobId, JobStatus status, Instant createdAt) {

  static AsyncJobResponse from(JobRecord record) {
    return new AsyncJobResponse(record.jobId(), record.status(), record.createdAt());
  }
}
