package com.scholary.diarizer.diarization;

/** Exception thrown when diarization fails or finds no speech. */
public class DiarizationException extends RuntimeException {

  public DiarizationException(String message) {
    super(message);
  }

  public DiarizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
