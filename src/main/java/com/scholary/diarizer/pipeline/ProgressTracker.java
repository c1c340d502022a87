package com.scholary.diarizer.pipeline;

import com.scholary.diarizer.job.JobRecordStore;
import com.scholary.diarizer.job.JobStatus;
import com.scholary.diarizer.job.JobStoreException;
import com.scholary.diarizer.job.JobUpdate;
import com.scholary.diarizer.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a run's status and progress to the job store.
 *
 * <p>The percentage never goes down within a run: a lower value than the last one written is
 * raised to it. Store failures are logged and the run carries on.
 */
class ProgressTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final String jobId;
  private final JobRecordStore store;
  private int lastPercent;

  ProgressTracker(String jobId, JobRecordStore store) {
    this.jobId = jobId;
    this.store = store;
  }

  void update(JobStatus status, String progress, int percent) {
    int clamped = Math.min(100, Math.max(lastPercent, percent));
    try {
      store.update(jobId, JobUpdate.progress(status, progress, clamped));
      lastPercent = clamped;
      STRUCTURED_LOGGER.logJobProgress(jobId, status.value(), clamped, progress);
    } catch (JobStoreException e) {
      LOGGER.warn("Could not record progress for job {}: {}", jobId, e.getMessage());
    }
  }
}
