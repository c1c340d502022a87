package com.scholary.diarizer.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a job, in pipeline order.
 *
 * <p>A job only moves forward through this order, or jumps to {@link #FAILED} from any state that
 * is not terminal. {@link #LLM_ANALYSIS} is skipped when enhancement was not requested.
 */
public enum JobStatus {
  PENDING,
  PROCESSING,
  PREPROCESSING,
  DIARIZING,
  TRANSCRIBING,
  LLM_ANALYSIS,
  FORMATTING,
  COMPLETED,
  FAILED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Whether a record in this state may be moved to {@code next}. Staying in the same state is
   * allowed so progress text can be updated within a stage.
   */
  public boolean canTransitionTo(JobStatus next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return next.ordinal() >= ordinal();
  }
}
