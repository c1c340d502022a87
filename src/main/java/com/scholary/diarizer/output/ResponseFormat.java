package com.scholary.diarizer.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Output representation chosen when a job is submitted. */
public enum ResponseFormat {
  JSON("json"),
  SRT("srt"),
  VTT("vtt"),
  TEXT("text");

  private final String value;

  ResponseFormat(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parse a format name as clients send it.
   *
   * @param value the format name, case-insensitive; null or blank selects JSON
   * @return the matching format
   * @throws IllegalArgumentException if the name is unknown
   */
  @JsonCreator
  public static ResponseFormat fromValue(String value) {
    if (value == null || value.isBlank()) {
      return JSON;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ResponseFormat format : values()) {
      if (format.value.equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException(
        "Unsupported response format: " + value + " (expected json, srt, vtt or text)");
  }
}
