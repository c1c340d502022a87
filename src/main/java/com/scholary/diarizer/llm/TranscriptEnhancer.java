package com.scholary.diarizer.llm;

import com.scholary.diarizer.transcript.TranscribedSegment;
import java.util.List;
import java.util.Optional;

/**
 * Generates a summary, action items and topics for a transcript.
 *
 * <p>Best-effort: implementations never throw for collaborator failures, they return an empty
 * result instead.
 */
public interface TranscriptEnhancer {

  /** Whether enhancement is switched on in configuration. */
  boolean isEnabled();

  /** Whether the model server answers right now. Always false when disabled. */
  boolean isAvailable();

  /**
   * Analyse the merged utterances.
   *
   * @return the enhancements, or empty when nothing usable came back
   */
  Optional<LlmEnhancements> enhance(List<TranscribedSegment> utterances);

  /** Model name reported by the status endpoint, or null when disabled. */
  String model();
}
