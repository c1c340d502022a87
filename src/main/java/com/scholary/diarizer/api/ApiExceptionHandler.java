package com.scholary.diarizer.api;

import com.scholary.diarizer.job.JobStoreException;
import com.scholary.diarizer.objectstore.ObjectStoreException;
import com.scholary.diarizer.service.InvalidSubmissionException;
import com.scholary.diarizer.service.JobNotFoundException;
import com.scholary.diarizer.service.SubmissionTooLargeException;
import com.scholary.diarizer.upload.UploadException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Converts exceptions at the REST boundary into {@link ApiError} responses.
 *
 * <p>Client mistakes map to 4xx with the reason in {@code details}. Store and object-store outages
 * map to 503. Anything else is a 500 that hides internal details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidSubmissionException.class)
  ResponseEntity<ApiError> handleInvalidSubmission(InvalidSubmissionException ex) {
    LOGGER.warn("Rejected submission: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "InvalidSubmission", "Invalid submission", ex);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
    LOGGER.warn("Bad request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Invalid request", ex);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed: {}", details);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiError("ValidationFailed", "Request validation failed", details, Instant.now()));
  }

  @ExceptionHandler({TypeMismatchException.class, HttpMessageNotReadableException.class})
  ResponseEntity<ApiError> handleUnreadable(Exception ex) {
    LOGGER.warn("Unreadable request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Invalid request", ex);
  }

  @ExceptionHandler(SubmissionTooLargeException.class)
  ResponseEntity<ApiError> handleTooLarge(SubmissionTooLargeException ex) {
    LOGGER.warn("Rejected submission: {}", ex.getMessage());
    return error(HttpStatus.PAYLOAD_TOO_LARGE, "FileTooLarge", "File too large", ex);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  ResponseEntity<ApiError> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
    LOGGER.warn("Upload exceeded multipart limit: {}", ex.getMessage());
    return error(HttpStatus.PAYLOAD_TOO_LARGE, "FileTooLarge", "File too large", ex);
  }

  @ExceptionHandler(JobNotFoundException.class)
  ResponseEntity<ApiError> handleNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "JobNotFound", "Job not found", ex);
  }

  @ExceptionHandler(ObjectStoreException.class)
  ResponseEntity<ApiError> handleObjectStore(ObjectStoreException ex) {
    LOGGER.error("Object store error: {}", ex.getMessage());
    HttpStatus status = ex.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.SERVICE_UNAVAILABLE;
    return error(status, "ObjectStoreError", "Object store request failed", ex);
  }

  @ExceptionHandler(JobStoreException.class)
  ResponseEntity<ApiError> handleJobStore(JobStoreException ex) {
    LOGGER.error("Job store error: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiError(
                "JobStoreUnavailable",
                "Job store temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()));
  }

  @ExceptionHandler(UploadException.class)
  ResponseEntity<ApiError> handleUpload(UploadException ex) {
    LOGGER.error("Upload failed: {}", ex.getMessage(), ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "UploadFailed", "Failed to save file", ex);
  }

  /** Catch-all; Spring MVC exceptions keep the status they carry. */
  @ExceptionHandler(Exception.class)
  ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse) {
      HttpStatusCode status = errorResponse.getStatusCode();
      LOGGER.warn("Request failed with {}: {}", status.value(), ex.getMessage());
      return ResponseEntity.status(status)
          .body(
              new ApiError(
                  ex.getClass().getSimpleName(),
                  "Request failed",
                  errorResponse.getBody().getDetail(),
                  Instant.now()));
    }

    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with the job ID",
                Instant.now()));
  }

  private static ResponseEntity<ApiError> error(
      HttpStatus status, String errorCode, String message, Exception ex) {
    return ResponseEntity.status(status)
        .body(new ApiError(errorCode, message, ex.getMessage(), Instant.now()));
  }

  /** Standardized error response for API clients. */
  public record ApiError(String errorCode, String message, String details, Instant timestamp) {}
}
