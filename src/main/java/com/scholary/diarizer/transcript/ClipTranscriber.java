package com.scholary.diarizer.transcript;

import com.scholary.diarizer.audio.AudioClip;
import com.scholary.diarizer.logging.StructuredLogger;
import com.scholary.diarizer.whisper.WhisperResponse;
import com.scholary.diarizer.whisper.WhisperService;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transcribes clips one at a time and places the results on the recording's timeline.
 *
 * <p>Word times returned by the transcription service are clip-relative; they are shifted by the
 * clip's unpadded start. A clip that fails to transcribe is kept as a placeholder segment so the
 * rest of the job can still complete.
 */
@Component
public class ClipTranscriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipTranscriber.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  /** Called after each clip, whether it succeeded or fell back to a placeholder. */
  @FunctionalInterface
  public interface ClipProgressListener {
    void clipCompleted(int completed, int total);
  }

  private final WhisperService whisperService;

  public ClipTranscriber(WhisperService whisperService) {
    this.whisperService = whisperService;
  }

  /**
   * Transcribe every clip in order.
   *
   * @param clips clips in diarization turn order
   * @param sampleRate sample rate of the clip buffers
   * @param listener progress callback
   * @return one segment per clip, in the same order as {@code clips}
   */
  public List<TranscribedSegment> transcribe(
      List<AudioClip> clips, int sampleRate, ClipProgressListener listener) {
    List<TranscribedSegment> segments = new ArrayList<>(clips.size());

    for (int i = 0; i < clips.size(); i++) {
      AudioClip clip = clips.get(i);
      segments.add(transcribeClip(clip, sampleRate, i));
      listener.clipCompleted(i + 1, clips.size());
    }

    long failed = segments.stream().filter(TranscribedSegment::isPlaceholder).count();
    if (failed > 0) {
      LOGGER.warn("{} of {} clips could not be transcribed", failed, clips.size());
    }
    return segments;
  }

  private TranscribedSegment transcribeClip(AudioClip clip, int sampleRate, int index) {
    STRUCTURED_LOGGER.logClipStarted(index, clip.speaker(), clip.start(), clip.end());
    long startTime = System.currentTimeMillis();

    try {
      WhisperResponse response = whisperService.transcribe(clip.samples(), sampleRate, index);

      List<WordTimestamp> words = new ArrayList<>(response.words().size());
      for (WhisperResponse.WhisperWord word : response.words()) {
        words.add(
            new WordTimestamp(
                word.word(),
                clip.start() + word.start(),
                clip.start() + word.end(),
                word.probability()));
      }

      STRUCTURED_LOGGER.logClipFinished(
          index, clip.speaker(), System.currentTimeMillis() - startTime);
      return new TranscribedSegment(
          clip.speaker(),
          clip.start(),
          clip.end(),
          response.text().trim(),
          response.confidence(),
          words);

    } catch (RuntimeException e) {
      STRUCTURED_LOGGER.logClipFailed(index, clip.start(), clip.end(), e);
      return TranscribedSegment.placeholder(clip);
    }
  }
}
