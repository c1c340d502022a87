package com.scholary.diarizer.job;

import java.time.Instant;

/**
 * Partial update of a {@link JobRecord}. Null fields leave the stored value unchanged.
 *
 * <p>Built through the static factories, one per kind of transition the pipeline makes.
 */
public record JobUpdate(
    JobStatus status,
    String progress,
    Integer progressPercent,
    String error,
    String result,
    Instant completedAt) {

  /** Move to {@code status} with new progress text and percentage. */
  public static JobUpdate progress(JobStatus status, String progress, int progressPercent) {
    return new JobUpdate(status, progress, progressPercent, null, null, null);
  }

  /** Record a successful run. */
  public static JobUpdate completed(String result, Instant completedAt) {
    return new JobUpdate(JobStatus.COMPLETED, "Completed", 100, null, result, completedAt);
  }

  /** Record a failed run. */
  public static JobUpdate failed(String error, Instant completedAt) {
    return new JobUpdate(JobStatus.FAILED, null, null, error, null, completedAt);
  }

  /**
   * Apply this update to a stored record.
   *
   * @throws IllegalStateException if the status change would move the job backwards or out of a
   *     terminal state
   */
  JobRecord applyTo(JobRecord current) {
    JobStatus nextStatus = status != null ? status : current.status();
    if (status != null && !current.status().canTransitionTo(status)) {
      throw new IllegalStateException(
          String.format(
              "Job %s cannot move from %s to %s",
              current.jobId(), current.status().value(), status.value()));
    }

    return new JobRecord(
        current.jobId(),
        nextStatus,
        current.createdAt(),
        completedAt != null ? completedAt : current.completedAt(),
        progress != null ? progress : current.progress(),
        progressPercent != null ? progressPercent : current.progressPercent(),
        error != null ? error : current.error(),
        result != null ? result : current.result(),
        current.filePath(),
        current.expectedSpeakers(),
        current.responseFormat(),
        current.enableLlmAnalysis());
  }
}
