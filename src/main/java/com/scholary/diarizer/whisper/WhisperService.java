package com.scholary.diarizer.whisper;

/**
 * Interface for transcription services.
 *
 * <p>Lets the pipeline switch between the Whisper HTTP service and the stub without changing
 * business logic.
 */
public interface WhisperService {

  /**
   * Transcribe one clip.
   *
   * @param samples mono samples in [-1, 1]
   * @param sampleRate samples per second
   * @param clipIndex position of the clip in the job, for logging
   * @return text, optional confidence and word timings relative to the clip start
   * @throws WhisperException if transcription fails
   */
  WhisperResponse transcribe(float[] samples, int sampleRate, int clipIndex);

  /** Short name of the variant, reported by the health endpoint. */
  String name();
}
