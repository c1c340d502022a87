package com.scholary.diarizer.diarization;

/** One speaker's continuous speech interval, in seconds from the start of the recording. */
public record DiarizationTurn(double start, double end, String speaker) {

  public DiarizationTurn {
    if (!(start < end)) {
      throw new IllegalArgumentException(
          String.format("Turn start %.3f must be before end %.3f", start, end));
    }
    if (start < 0) {
      throw new IllegalArgumentException("Turn start must not be negative: " + start);
    }
  }
}
