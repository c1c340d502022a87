package com.scholary.diarizer.diarization;

import java.nio.file.Path;
import java.util.List;

/**
 * Finds who spoke when.
 *
 * <p>Implementations may return turns in any order and with the model's own speaker labels; the
 * pipeline sorts and relabels them through {@link SpeakerLabels#canonicalize}.
 */
public interface SpeakerDiarizer {

  /**
   * Diarize a normalized recording.
   *
   * @param audioFile the preprocessed WAV file
   * @param expectedSpeakers speaker count hint, or null to let the model decide
   * @return the turns, possibly empty
   * @throws DiarizationException if the recording cannot be diarized
   */
  List<DiarizationTurn> diarize(Path audioFile, Integer expectedSpeakers);

  /** Short name of the variant, reported by the health endpoint. */
  String name();
}
