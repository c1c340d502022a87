package com.scholary.diarizer.cli;

/** Command-line arguments that cannot be turned into a run. */
public class CliUsageException extends RuntimeException {

  public CliUsageException(String message) {
    super(message);
  }
}
