package com.scholary.diarizer.whisper;

import com.scholary.diarizer.whisper.WhisperResponse.WhisperWord;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic transcription for development and tests.
 *
 * <p>Emits one placeholder word per started second of audio, evenly spaced across the clip.
 */
@Component
@ConditionalOnProperty(name = "whisper.mode", havingValue = "stub")
public class StubWhisperService implements WhisperService {

  static final double STUB_CONFIDENCE = 0.9;

  @Override
  public WhisperResponse transcribe(float[] samples, int sampleRate, int clipIndex) {
    double duration = sampleRate > 0 ? samples.length / (double) sampleRate : 0.0;
    int wordCount = Math.max(1, (int) Math.ceil(duration));
    double wordLength = duration / wordCount;

    List<WhisperWord> words = new ArrayList<>(wordCount);
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < wordCount; i++) {
      String word = "word" + (i + 1);
      words.add(new WhisperWord(word, i * wordLength, (i + 1) * wordLength, STUB_CONFIDENCE));
      if (i > 0) {
        text.append(' ');
      }
      text.append(word);
    }
    return new WhisperResponse("Clip " + clipIndex + ": " + text, STUB_CONFIDENCE, words);
  }

  @Override
  public String name() {
    return "stub";
  }
}
