package com.scholary.diarizer.audio;

import java.nio.file.Path;

/** Decodes and normalizes an uploaded recording before it is diarized. */
public interface AudioPreprocessor {

  /**
   * Convert the recording to a loudness-normalized mono WAV at the pipeline sample rate.
   *
   * @param source the uploaded file
   * @return the normalized file and the source duration
   * @throws AudioValidationException if the recording is longer than allowed
   * @throws AudioProcessingException if the recording cannot be decoded
   */
  PreprocessedAudio preprocess(Path source);

  /** Where {@link #preprocess} writes its output for the given source. */
  Path outputPathFor(Path source);
}
