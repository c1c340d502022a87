package com.scholary.diarizer.job;

import com.scholary.diarizer.output.ResponseFormat;

/** Per-job choices made by the client at submission. */
public record JobOptions(
    Integer expectedSpeakers, ResponseFormat responseFormat, boolean enableLlmAnalysis) {

  public static final int MIN_EXPECTED_SPEAKERS = 2;
  public static final int MAX_EXPECTED_SPEAKERS = 10;

  public JobOptions {
    responseFormat = responseFormat == null ? ResponseFormat.JSON : responseFormat;
  }
}
