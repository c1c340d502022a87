package com.scholary.diarizer.audio;

/** Thrown when a recording is readable but outside the accepted limits. */
public class AudioValidationException extends RuntimeException {

  public AudioValidationException(String message) {
    super(message);
  }
}
