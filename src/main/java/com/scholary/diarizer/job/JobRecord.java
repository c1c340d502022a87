package com.scholary.diarizer.job;

import com.scholary.diarizer.output.ResponseFormat;
import java.time.Instant;

/**
 * Stored state of one job.
 *
 * <p>Immutable; the store replaces the whole record when a {@link JobUpdate} is applied.
 * {@code result} holds the formatted transcript once the job has completed.
 */
public record JobRecord(
    String jobId,
    JobStatus status,
    Instant createdAt,
    Instant completedAt,
    String progress,
    Integer progressPercent,
    String error,
    String result,
    String filePath,
    Integer expectedSpeakers,
    ResponseFormat responseFormat,
    boolean enableLlmAnalysis) {

  /** A freshly submitted job that no worker has picked up yet. */
  public static JobRecord pending(
      String jobId, Instant createdAt, String filePath, JobOptions options) {
    return new JobRecord(
        jobId,
        JobStatus.PENDING,
        createdAt,
        null,
        null,
        null,
        null,
        null,
        filePath,
        options.expectedSpeakers(),
        options.responseFormat(),
        options.enableLlmAnalysis());
  }
}
