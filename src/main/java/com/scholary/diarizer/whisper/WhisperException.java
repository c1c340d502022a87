package com.scholary.diarizer.whisper;

/**
 * A clip could not be transcribed.
 *
 * <p>The pipeline does not fail the job on this; the clip is kept as a placeholder segment.
 */
public class WhisperException extends RuntimeException {

  private final int clipIndex;

  public WhisperException(int clipIndex, String message) {
    this(clipIndex, message, null);
  }

  public WhisperException(int clipIndex, String message, Throwable cause) {
    super(message, cause);
    this.clipIndex = clipIndex;
  }

  /** Zero-based index of the clip within the job. */
  public int clipIndex() {
    return clipIndex;
  }
}
