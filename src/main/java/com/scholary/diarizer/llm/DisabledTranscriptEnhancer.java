package com.scholary.diarizer.llm;

import com.scholary.diarizer.transcript.TranscribedSegment;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when {@code llm.enabled} is false; never produces enhancements. */
@Component
@ConditionalOnProperty(name = "llm.enabled", havingValue = "false", matchIfMissing = true)
public class DisabledTranscriptEnhancer implements TranscriptEnhancer {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public boolean isAvailable() {
    return false;
  }

  @Override
  public Optional<LlmEnhancements> enhance(List<TranscribedSegment> utterances) {
    return Optional.empty();
  }

  @Override
  public String model() {
    return null;
  }
}
