package com.scholary.diarizer.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.scholary.diarizer.llm.LlmEnhancements;
import com.scholary.diarizer.transcript.TranscribedSegment;
import java.util.List;

/** JSON shape of a finished transcript. */
@JsonPropertyOrder({"utterances", "audio_duration", "speakers_detected", "llm_enhancements"})
@JsonInclude(JsonInclude.Include.NON_NULL)
record StructuredTranscript(
    @JsonProperty("utterances") List<Utterance> utterances,
    @JsonProperty("audio_duration") double audioDuration,
    @JsonProperty("speakers_detected") int speakersDetected,
    @JsonProperty("llm_enhancements") Enhancements llmEnhancements) {

  static StructuredTranscript of(
      List<TranscribedSegment> segments,
      double audioDuration,
      int speakersDetected,
      LlmEnhancements enhancements) {
    List<Utterance> utterances =
        segments.stream()
            .map(s -> new Utterance(s.speaker(), s.start(), s.end(), s.text(), s.confidence()))
            .toList();
    Enhancements llm =
        enhancements == null
            ? null
            : new Enhancements(
                enhancements.summary(), enhancements.actionItems(), enhancements.topics());
    return new StructuredTranscript(utterances, audioDuration, speakersDetected, llm);
  }

  @JsonPropertyOrder({"speaker", "start", "end", "text", "confidence"})
  @JsonInclude(JsonInclude.Include.ALWAYS)
  record Utterance(String speaker, double start, double end, String text, Double confidence) {}

  @JsonPropertyOrder({"summary", "action_items", "topics"})
  @JsonInclude(JsonInclude.Include.ALWAYS)
  record Enhancements(
      @JsonProperty("summary") String summary,
      @JsonProperty("action_items") String actionItems,
      @JsonProperty("topics") String topics) {}
}
