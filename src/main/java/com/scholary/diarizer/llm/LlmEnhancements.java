package com.scholary.diarizer.llm;

/**
 * Summary, action items and topics generated for a finished transcript.
 *
 * <p>Each field is null when the model produced nothing usable for it.
 */
public record LlmEnhancements(String summary, String actionItems, String topics) {

  public boolean isEmpty() {
    return summary == null && actionItems == null && topics == null;
  }
}
