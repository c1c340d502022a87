package com.scholary.diarizer.service;

import com.scholary.diarizer.config.PipelineProperties;
import com.scholary.diarizer.job.JobOptions;
import com.scholary.diarizer.job.JobRecord;
import com.scholary.diarizer.job.JobRecordStore;
import com.scholary.diarizer.job.JobStoreException;
import com.scholary.diarizer.objectstore.ObjectStoreClient;
import com.scholary.diarizer.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.diarizer.objectstore.ObjectStoreProperties;
import com.scholary.diarizer.upload.UploadException;
import com.scholary.diarizer.upload.UploadStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Accepts recordings, creates their job records and queues them.
 *
 * <p>Validation happens before anything is stored. Once the upload is on disk, a failure to
 * create the record removes it again, so no file is left without a job that owns it.
 */
@Service
public class JobSubmissionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobSubmissionService.class);

  private final JobRecordStore store;
  private final UploadStore uploads;
  private final JobDispatcher dispatcher;
  private final ObjectStoreClient objectStoreClient;
  private final Clock clock;
  private final long maxFileSizeBytes;
  private final ObjectStoreProperties objectStoreProperties;

  public JobSubmissionService(
      JobRecordStore store,
      UploadStore uploads,
      JobDispatcher dispatcher,
      ObjectStoreClient objectStoreClient,
      Clock clock,
      PipelineProperties properties,
      ObjectStoreProperties objectStoreProperties) {
    this.store = store;
    this.uploads = uploads;
    this.dispatcher = dispatcher;
    this.objectStoreClient = objectStoreClient;
    this.clock = clock;
    this.maxFileSizeBytes = properties.maxFileSizeBytes();
    this.objectStoreProperties = objectStoreProperties;
  }

  /**
   * Submit an uploaded recording.
   *
   * @return the job record as it stands after queueing
   * @throws InvalidSubmissionException if the file is not audio or the options are invalid
   * @throws SubmissionTooLargeException if the file exceeds the size limit
   * @throws JobStoreException if the job record cannot be created
   */
  public JobRecord submitUpload(MultipartFile file, JobOptions options) {
    validateOptions(options);
    String contentType = file.getContentType();
    if (contentType == null || !contentType.startsWith("audio/")) {
      throw new InvalidSubmissionException("File must be an audio file");
    }
    if (file.isEmpty()) {
      throw new InvalidSubmissionException("File is empty");
    }
    checkSize(file.getSize());

    String jobId = newJobId();
    Path stored;
    try (InputStream content = file.getInputStream()) {
      stored = uploads.store(jobId, file.getOriginalFilename(), content);
    } catch (IOException e) {
      throw new UploadException("Failed to read upload: " + e.getMessage(), e);
    }
    return createAndDispatch(jobId, stored, options);
  }

  /**
   * Submit a recording held in the object store.
   *
   * @param bucket the bucket, or null for the configured default
   * @return the job record as it stands after queueing
   * @throws InvalidSubmissionException if the options are invalid
   * @throws SubmissionTooLargeException if the object exceeds the size limit
   * @throws com.scholary.diarizer.objectstore.ObjectStoreException if the object cannot be read
   */
  public JobRecord submitFromObjectStore(String bucket, String key, JobOptions options) {
    validateOptions(options);
    bucket = objectStoreProperties.bucketOrDefault(bucket);
    ObjectMetadata metadata = objectStoreClient.getObjectMetadata(bucket, key);
    checkSize(metadata.contentLength());

    String jobId = newJobId();
    Path stored;
    try (InputStream content = objectStoreClient.getObjectStream(bucket, key)) {
      stored = uploads.store(jobId, key, content);
    } catch (IOException e) {
      throw new UploadException("Failed to download object: " + e.getMessage(), e);
    }
    LOGGER.info("Imported object for job {}: bucket={}, key={}", jobId, bucket, key);
    return createAndDispatch(jobId, stored, options);
  }

  /** Current state of a job, empty when unknown or expired. */
  public Optional<JobRecord> find(String jobId) {
    return store.find(jobId);
  }

  /**
   * Remove a job's record and its upload if it is still present.
   *
   * @throws JobNotFoundException if the job is unknown or expired
   */
  public void delete(String jobId) {
    JobRecord job = store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (job.filePath() != null) {
      uploads.deleteQuietly(Path.of(job.filePath()));
    }
    store.delete(jobId);
    LOGGER.info("Deleted job {}", jobId);
  }

  private JobRecord createAndDispatch(String jobId, Path stored, JobOptions options) {
    JobRecord record = JobRecord.pending(jobId, clock.instant(), stored.toString(), options);
    try {
      store.create(record);
    } catch (JobStoreException e) {
      uploads.deleteQuietly(stored);
      throw e;
    }

    dispatcher.dispatch(jobId, stored);
    return store.find(jobId).orElse(record);
  }

  private void validateOptions(JobOptions options) {
    Integer expected = options.expectedSpeakers();
    if (expected != null
        && (expected < JobOptions.MIN_EXPECTED_SPEAKERS
            || expected > JobOptions.MAX_EXPECTED_SPEAKERS)) {
      throw new InvalidSubmissionException(
          String.format(
              "expectedSpeakers must be between %d and %d",
              JobOptions.MIN_EXPECTED_SPEAKERS, JobOptions.MAX_EXPECTED_SPEAKERS));
    }
  }

  private void checkSize(long size) {
    if (size > maxFileSizeBytes) {
      throw new SubmissionTooLargeException(size, maxFileSizeBytes);
    }
  }

  private static String newJobId() {
    return UUID.randomUUID().toString();
  }
}
