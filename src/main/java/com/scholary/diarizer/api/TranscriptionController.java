package com.scholary.diarizer.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.diarizer.job.JobOptions;
import com.scholary.diarizer.job.JobRecord;
import com.scholary.diarizer.output.ResponseFormat;
import com.scholary.diarizer.service.JobNotFoundException;
import com.scholary.diarizer.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for diarized transcription jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting an uploaded recording or an object-store reference
 *   <li>Polling job status and fetching the result
 *   <li>Deleting a job
 * </ul>
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Transcription", description = "Speaker-attributed transcription jobs")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final JobSubmissionService submissionService;
  private final ObjectMapper objectMapper;

  public TranscriptionController(
      JobSubmissionService submissionService, ObjectMapper objectMapper) {
    this.submissionService = submissionService;
    this.objectMapper = objectMapper;
  }

  @PostMapping(value = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Submit an audio file",
      description =
          "Stores the upload and queues a diarization and transcription job. "
              + "Poll GET /api/jobs/{jobId} for progress and the result.")
  public ResponseEntity<AsyncJobResponse> transcribe(
      @RequestPart("file") MultipartFile file,
      @RequestParam(value = "expectedSpeakers", required = false) Integer expectedSpeakers,
      @RequestParam(value = "responseFormat", defaultValue = "json") String responseFormat,
      @RequestParam(value = "enableLlmAnalysis", defaultValue = "false")
          boolean enableLlmAnalysis) {
    LOGGER.info(
        "Transcribe request: file={}, size={}, contentType={}, format={}",
        file.getOriginalFilename(),
        file.getSize(),
        file.getContentType(),
        responseFormat);

    JobOptions options =
        new JobOptions(
            expectedSpeakers, ResponseFormat.fromValue(responseFormat), enableLlmAnalysis);
    JobRecord job = submissionService.submitUpload(file, options);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(AsyncJobResponse.from(job));
  }

  @PostMapping("/transcribe/object")
  @Operation(
      summary = "Submit an object-store recording",
      description = "Downloads the object from the bucket and queues it like an upload.")
  public ResponseEntity<AsyncJobResponse> transcribeObject(
      @Valid @RequestBody ObjectTranscriptionRequest request) {
    LOGGER.info("Transcribe object request: bucket={}, key={}", request.bucket(), request.key());

    JobOptions options =
        new JobOptions(
            request.expectedSpeakers(),
            ResponseFormat.fromValue(request.responseFormat()),
            Boolean.TRUE.equals(request.enableLlmAnalysis()));
    JobRecord job =
        submissionService.submitFromObjectStore(request.bucket(), request.key(), options);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(AsyncJobResponse.from(job));
  }

  @GetMapping("/jobs/{jobId}")
  @Operation(summary = "Get job status", description = "Status, progress and, once done, result")
  public JobStatusResponse getJob(@PathVariable String jobId) {
    JobRecord job =
        submissionService.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    return JobStatusResponse.from(job, objectMapper);
  }

  @DeleteMapping("/jobs/{jobId}")
  @Operation(summary = "Delete a job", description = "Removes the record and any stored upload")
  public Map<String, String> deleteJob(@PathVariable String jobId) {
    submissionService.delete(jobId);
    return Map.of("message", "Job " + jobId + " deleted successfully");
  }
}
