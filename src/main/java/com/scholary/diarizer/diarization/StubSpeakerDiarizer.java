package com.scholary.diarizer.diarization;

import com.scholary.diarizer.audio.AudioProcessingException;
import com.scholary.diarizer.audio.WavAudioReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic diarizer for development and tests.
 *
 * <p>Splits the recording into about eight equal turns of at least two seconds and hands them to
 * the expected number of speakers in rotation (two when no hint is given).
 */
@Component
@ConditionalOnProperty(name = "diarization.mode", havingValue = "stub")
public class StubSpeakerDiarizer implements SpeakerDiarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(StubSpeakerDiarizer.class);

  static final double FALLBACK_DURATION_SECONDS = 20.0;
  private static final double MIN_TURN_SECONDS = 2.0;
  private static final int TARGET_TURNS = 8;
  private static final int DEFAULT_SPEAKERS = 2;

  private final WavAudioReader reader;

  public StubSpeakerDiarizer(WavAudioReader reader) {
    this.reader = reader;
  }

  @Override
  public List<DiarizationTurn> diarize(Path audioFile, Integer expectedSpeakers) {
    double duration = durationOf(audioFile);
    int speakers =
        expectedSpeakers != null && expectedSpeakers > 0 ? expectedSpeakers : DEFAULT_SPEAKERS;
    double turnLength = Math.max(MIN_TURN_SECONDS, duration / TARGET_TURNS);

    List<DiarizationTurn> turns = new ArrayList<>();
    double current = 0.0;
    int speaker = 0;
    while (current < duration) {
      double end = Math.min(current + turnLength, duration);
      turns.add(new DiarizationTurn(current, end, SpeakerLabels.label(speaker)));
      current = end;
      speaker = (speaker + 1) % speakers;
    }

    LOGGER.info(
        "Stub diarization: duration={}s, speakers={}, turns={}", duration, speakers, turns.size());
    return turns;
  }

  @Override
  public String name() {
    return "stub";
  }

  private double durationOf(Path audioFile) {
    try {
      return reader.durationSeconds(audioFile);
    } catch (AudioProcessingException e) {
      LOGGER.warn(
          "Could not read duration of {}, assuming {}s: {}",
          audioFile.getFileName(),
          FALLBACK_DURATION_SECONDS,
          e.getMessage());
      return FALLBACK_DURATION_SECONDS;
    }
  }
}
