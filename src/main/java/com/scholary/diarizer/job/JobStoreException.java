package com.scholary.diarizer.job;

/** Thrown when the job store cannot read or write a record. */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message) {
    super(message);
  }

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
