package com.scholary.diarizer.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.diarizer.job.JobRecord;
import com.scholary.diarizer.job.JobStatus;
import com.scholary.diarizer.output.ResponseFormat;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a job and includes the result once completed. A JSON result is
 * embedded as a document; SRT, VTT and text results are returned as strings.
 */
public record JobStatusResponse(
    String jobId,
    JobStatus status,
    Instant createdAt,
    Instant completedAt,
    String progress,
    Integer progressPercent,
    String error,
    ResponseFormat responseFormat,
    Object result) {

  static JobStatusResponse from(JobRecord record, ObjectMapper objectMapper) {
    return new JobStatusResponse(
        record.jobId(),
        record.status(),
        record.createdAt(),
        record.completedAt(),
        record.progress(),
        record.progressPercent(),
        record.error(),
        record.responseFormat(),
        result(record, objectMapper));
  }

  private static Object result(JobRecord record, ObjectMapper objectMapper) {
    if (record.status() != JobStatus.COMPLETED || record.result() == null) {
      return null;
    }
    if (record.responseFormat() != ResponseFormat.JSON) {
      return record.result();
    }
    try {
      return objectMapper.readTree(record.result());
    } catch (JsonProcessingException e) {
      return record.result();
    }
  }
}
