package com.scholary.diarizer.upload;

/** Thrown when an uploaded recording cannot be written to the upload directory. */
public class UploadException extends RuntimeException {

  public UploadException(String message, Throwable cause) {
    super(message, cause);
  }
}
