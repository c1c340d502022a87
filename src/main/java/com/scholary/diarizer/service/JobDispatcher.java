package com.scholary.diarizer.service;

import com.scholary.diarizer.job.JobRecordStore;
import com.scholary.diarizer.job.JobUpdate;
import com.scholary.diarizer.pipeline.JobPipeline;
import com.scholary.diarizer.upload.UploadStore;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Hands jobs to the worker pool.
 *
 * <p>Each job is submitted once, so it runs on exactly one worker. When the queue is full the job
 * is marked failed and its upload removed; the client sees the failure when it polls.
 */
@Component
public class JobDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobDispatcher.class);

  private final Executor workerExecutor;
  private final JobPipeline pipeline;
  private final JobRecordStore store;
  private final UploadStore uploads;
  private final Clock clock;

  public JobDispatcher(
      @Qualifier("workerExecutor") Executor workerExecutor,
      JobPipeline pipeline,
      JobRecordStore store,
      UploadStore uploads,
      Clock clock) {
    this.workerExecutor = workerExecutor;
    this.pipeline = pipeline;
    this.store = store;
    this.uploads = uploads;
    this.clock = clock;
  }

  /**
   * Queue a job that already has a pending record.
   *
   * @return true if the job was queued, false if the queue rejected it
   */
  public boolean dispatch(String jobId, Path upload) {
    try {
      workerExecutor.execute(() -> pipeline.run(jobId));
      LOGGER.info("Queued job {}", jobId);
      return true;

    } catch (RejectedExecutionException e) {
      LOGGER.error("Worker queue rejected job {}: {}", jobId, e.getMessage());
      String error = String.format("Job %s could not be queued: worker queue is full", jobId);
      try {
        store.update(jobId, JobUpdate.failed(error, clock.instant()));
      } catch (RuntimeException storeError) {
        LOGGER.error("Could not record rejection of job {}: {}", jobId, storeError.getMessage());
      }
      uploads.deleteQuietly(upload);
      return false;
    }
  }
}
