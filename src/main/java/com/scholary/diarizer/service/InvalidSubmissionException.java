package com.scholary.diarizer.service;

/** Thrown when a submission is rejected before any file is stored. */
public class InvalidSubmissionException extends RuntimeException {

  public InvalidSubmissionException(String message) {
    super(message);
  }
}
