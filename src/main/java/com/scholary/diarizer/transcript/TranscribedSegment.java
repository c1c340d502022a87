package com.scholary.diarizer.transcript;

import com.scholary.diarizer.audio.AudioClip;
import java.util.List;

/**
 * Transcribed speech attributed to one speaker.
 *
 * <p>Produced once per clip by the {@link ClipTranscriber}; after {@link SegmentMerger} runs, one
 * instance covers a whole utterance that may span several clips. {@code confidence} is null when
 * the transcription service reported none.
 */
public record TranscribedSegment(
    String speaker,
    double start,
    double end,
    String text,
    Double confidence,
    List<WordTimestamp> words) {

  /** Text recorded for a clip whose transcription failed. */
  public static final String FAILURE_MARKER = "[Transcription failed]";

  public TranscribedSegment {
    words = words == null ? List.of() : List.copyOf(words);
  }

  /** Placeholder kept in the transcript when a clip could not be transcribed. */
  public static TranscribedSegment placeholder(AudioClip clip) {
    return new TranscribedSegment(
        clip.speaker(), clip.start(), clip.end(), FAILURE_MARKER, 0.0, List.of());
  }

  public boolean isPlaceholder() {
    return FAILURE_MARKER.equals(text) && words.isEmpty();
  }
}
