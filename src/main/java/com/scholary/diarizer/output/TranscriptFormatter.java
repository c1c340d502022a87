package com.scholary.diarizer.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.diarizer.llm.LlmEnhancements;
import com.scholary.diarizer.transcript.TranscribedSegment;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders merged utterances in the format a job was submitted with.
 *
 * <p>Every renderer is a pure function of its arguments: the same utterance list always produces
 * the same text.
 */
@Component
public class TranscriptFormatter {

  private final ObjectMapper objectMapper;

  public TranscriptFormatter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Render the transcript in the requested format.
   *
   * @param format the output format fixed at submission
   * @param utterances merged utterances in timeline order
   * @param audioDuration total duration of the recording in seconds
   * @param speakersDetected number of distinct speakers found by diarization
   * @param enhancements LLM output, or null when there is none
   * @return the rendered transcript
   * @throws JsonProcessingException if the structured form cannot be serialized
   */
  public String format(
      ResponseFormat format,
      List<TranscribedSegment> utterances,
      double audioDuration,
      int speakersDetected,
      LlmEnhancements enhancements)
      throws JsonProcessingException {
    return switch (format) {
      case JSON -> writeJson(utterances, audioDuration, speakersDetected, enhancements);
      case SRT -> writeSrt(utterances);
      case VTT -> writeVtt(utterances);
      case TEXT -> writeText(utterances);
    };
  }

  /**
   * Write transcript as JSON.
   *
   * <p>Format:
   *
   * <pre>
   * {"utterances":[{"speaker":"Speaker A","start":0.0,"end":5.2,"text":"Hello","confidence":0.9}],
   *  "audio_duration":12.5,"speakers_detected":2,
   *  "llm_enhancements":{"summary":"...","action_items":"...","topics":"..."}}
   * </pre>
   *
   * <p>{@code llm_enhancements} is omitted when there are none.
   */
  public String writeJson(
      List<TranscribedSegment> utterances,
      double audioDuration,
      int speakersDetected,
      LlmEnhancements enhancements)
      throws JsonProcessingException {
    return objectMapper.writeValueAsString(
        StructuredTranscript.of(utterances, audioDuration, speakersDetected, enhancements));
  }

  /**
   * Write transcript as SRT (SubRip subtitle format).
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:05,200
   * [Speaker A] Hello world
   *
   * 2
   * 00:00:05,200 --> 00:00:10,300
   * [Speaker B] This is a test
   * </pre>
   */
  public String writeSrt(List<TranscribedSegment> utterances) {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < utterances.size(); i++) {
      TranscribedSegment utterance = utterances.get(i);
      lines.add(String.valueOf(i + 1));
      lines.add(Timestamps.srt(utterance.start()) + " --> " + Timestamps.srt(utterance.end()));
      lines.add(captionText(utterance));
      lines.add("");
    }
    return String.join("\n", lines);
  }

  /**
   * Write transcript as WebVTT.
   *
   * <p>Same blocks as SRT without the sequence number, with a period before the milliseconds and
   * a {@code WEBVTT} header.
   */
  public String writeVtt(List<TranscribedSegment> utterances) {
    List<String> lines = new ArrayList<>();
    lines.add("WEBVTT");
    lines.add("");
    for (TranscribedSegment utterance : utterances) {
      lines.add(Timestamps.vtt(utterance.start()) + " --> " + Timestamps.vtt(utterance.end()));
      lines.add(captionText(utterance));
      lines.add("");
    }
    return String.join("\n", lines);
  }

  /** One {@code [HH:MM:SS,mmm] speaker: text} line per utterance. */
  public String writeText(List<TranscribedSegment> utterances) {
    List<String> lines = new ArrayList<>(utterances.size());
    for (TranscribedSegment utterance : utterances) {
      lines.add(
          "[" + Timestamps.srt(utterance.start()) + "] " + utterance.speaker() + ": "
              + utterance.text());
    }
    return String.join("\n", lines);
  }

  private static String captionText(TranscribedSegment utterance) {
    return "[" + utterance.speaker() + "] " + utterance.text();
  }
}
