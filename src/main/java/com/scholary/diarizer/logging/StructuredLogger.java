package com.scholary.diarizer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so a JSON encoder
 * or log shipper can index them. The job context ({@code jobId}, {@code file}) stays in place for
 * the whole run of a job.
 */
public class StructuredLogger {

  private static final String[] EVENT_FIELDS = {
    "event_type",
    "stage",
    "clip_index",
    "speaker",
    "start",
    "end",
    "durationMs",
    "errorType",
    "segmentsIn",
    "segmentsOut",
    "outcome",
    "status",
    "percentComplete"
  };

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String stage) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);

      logger.info("Stage started: {}", stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event with its wall-clock duration. */
  public void logStageFinished(String stage, long durationMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info("Stage finished: {}, took={}ms", stage, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log the failure that ended a job. */
  public void logStageFailed(String stage, Throwable error) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", error.getClass().getSimpleName());

      logger.error("Stage failed: {}, error={}", stage, error.getMessage(), error);
    } finally {
      clearEventFields();
    }
  }

  /** Log clip transcription started event. */
  public void logClipStarted(int clipIndex, String speaker, double start, double end) {
    try {
      MDC.put("event_type", "clip_started");
      MDC.put("clip_index", String.valueOf(clipIndex));
      MDC.put("speaker", speaker);
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug(
          "Clip started: index={}, speaker={}, range=[{}-{}]", clipIndex, speaker, start, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log clip transcription finished event. */
  public void logClipFinished(int clipIndex, String speaker, long durationMs) {
    try {
      MDC.put("event_type", "clip_finished");
      MDC.put("clip_index", String.valueOf(clipIndex));
      MDC.put("speaker", speaker);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.debug(
          "Clip finished: index={}, speaker={}, transcribe={}ms", clipIndex, speaker, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a clip that was replaced by a placeholder. */
  public void logClipFailed(int clipIndex, double start, double end, Throwable error) {
    try {
      MDC.put("event_type", "clip_failed");
      MDC.put("clip_index", String.valueOf(clipIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("errorType", error.getClass().getSimpleName());

      logger.warn(
          "Clip failed, using placeholder: index={}, range=[{}-{}], error={}",
          clipIndex,
          start,
          end,
          error.getMessage());
    } finally {
      clearEventFields();
    }
  }

  /** Log merge summary event. */
  public void logMerge(int segmentsIn, int segmentsOut) {
    try {
      MDC.put("event_type", "segments_merged");
      MDC.put("segmentsIn", String.valueOf(segmentsIn));
      MDC.put("segmentsOut", String.valueOf(segmentsOut));

      logger.info("Merged {} clip segments into {} utterances", segmentsIn, segmentsOut);
    } finally {
      clearEventFields();
    }
  }

  /** Log LLM enhancement outcome. */
  public void logLlmOutcome(String outcome) {
    try {
      MDC.put("event_type", "llm_outcome");
      MDC.put("outcome", outcome);

      logger.info("LLM analysis: {}", outcome);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, String status, int percentComplete, String progress) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("status", status);
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Job progress: jobId={}, status={}, progress={}%, {}",
          jobId,
          status,
          percentComplete,
          progress);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String file) {
    MDC.put("jobId", jobId);
    MDC.put("file", file);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("file");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    for (String field : EVENT_FIELDS) {
      MDC.remove(field);
    }
  }
}
