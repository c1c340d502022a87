package com.scholary.diarizer.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the Whisper API for one clip.
 *
 * <pre>
 * {
 *   "text": " Hello there.",
 *   "confidence": 0.93,
 *   "words": [{"word": "Hello", "start": 0.12, "end": 0.48, "probability": 0.98}]
 * }
 * </pre>
 *
 * <p>Word times are relative to the start of the clip that was sent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(String text, Double confidence, List<WhisperWord> words) {

  public WhisperResponse {
    text = text == null ? "" : text;
    words = words == null ? List.of() : List.copyOf(words);
  }

  /** A recognized word with clip-relative timing. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WhisperWord(String word, double start, double end, double probability) {}
}
