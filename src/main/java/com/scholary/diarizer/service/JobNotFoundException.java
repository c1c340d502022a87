package com.scholary.diarizer.service;

/** Thrown when a job id is unknown or its record has expired. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}
