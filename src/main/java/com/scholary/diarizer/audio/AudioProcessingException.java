package com.scholary.diarizer.audio;

/** Thrown when a recording cannot be inspected or decoded. */
public class AudioProcessingException extends RuntimeException {

  public AudioProcessingException(String message) {
    super(message);
  }

  public AudioProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
