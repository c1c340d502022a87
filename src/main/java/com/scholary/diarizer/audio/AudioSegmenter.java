package com.scholary.diarizer.audio;

import com.scholary.diarizer.config.PipelineProperties;
import com.scholary.diarizer.diarization.DiarizationTurn;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Cuts the recording into one padded clip per diarization turn.
 *
 * <p>Padding widens only the audio handed to transcription; each clip keeps the turn's own start
 * and end. Clips come out in turn order, and padded windows of neighbouring turns may overlap.
 */
@Component
public class AudioSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSegmenter.class);

  private final double paddingSeconds;

  @Autowired
  public AudioSegmenter(PipelineProperties properties) {
    this(properties.paddingSeconds());
  }

  public AudioSegmenter(double paddingSeconds) {
    if (paddingSeconds < 0) {
      throw new IllegalArgumentException("Padding must not be negative: " + paddingSeconds);
    }
    this.paddingSeconds = paddingSeconds;
  }

  /**
   * Slice the buffer around each turn.
   *
   * @param audio the whole recording
   * @param turns turns sorted by start
   * @return one clip per turn, in the same order
   */
  public List<AudioClip> segment(AudioBuffer audio, List<DiarizationTurn> turns) {
    int rate = audio.sampleRate();
    int paddingSamples = (int) (paddingSeconds * rate);
    float[] samples = audio.samples();

    List<AudioClip> clips = new ArrayList<>(turns.size());
    for (DiarizationTurn turn : turns) {
      int startSample = Math.max(0, (int) (turn.start() * rate) - paddingSamples);
      int endSample = Math.min(samples.length, (int) (turn.end() * rate) + paddingSamples);

      // A turn past the end of the decoded audio yields an empty clip rather than a bad range
      float[] slice =
          endSample > startSample
              ? Arrays.copyOfRange(samples, startSample, endSample)
              : new float[0];

      clips.add(
          new AudioClip(
              slice,
              turn.start(),
              turn.end(),
              turn.speaker(),
              startSample,
              Math.max(startSample, endSample)));
    }

    LOGGER.debug(
        "Segmented {} turns into clips: padding={}s, sampleRate={}",
        turns.size(),
        paddingSeconds,
        rate);
    return clips;
  }
}
