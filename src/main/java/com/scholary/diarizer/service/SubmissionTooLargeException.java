package com.scholary.diarizer.service;

/** Thrown when a recording is larger than the configured maximum. */
public class SubmissionTooLargeException extends RuntimeException {

  public SubmissionTooLargeException(long size, long maxSize) {
    super(
        String.format(
            "File size %d exceeds maximum allowed size of %d bytes", size, maxSize));
  }
}
