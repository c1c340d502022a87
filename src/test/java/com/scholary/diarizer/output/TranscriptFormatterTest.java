package com.scholary.diarizer.output;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.diarizer.llm.LlmEnhancements;
import com.scholary.diarizer.transcript.TranscribedSegment;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranscriptFormatterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private TranscriptFormatter formatter;
  private List<TranscribedSegment> utterances;

  @BeforeEach
  void setUp() {
    formatter = new TranscriptFormatter(objectMapper);
    utterances =
        List.of(
            new TranscribedSegment("Speaker A", 0.0, 5.2, "Hello world", 0.9, List.of()),
            new TranscribedSegment("Speaker B", 5.2, 10.3, "This is a test", null, List.of()));
  }

  @Test
  void writeSrt_shouldNumberBlocksAndTagSpeakers() {
    String srt = formatter.writeSrt(utterances);

    assertThat(srt)
        .isEqualTo(
            "1\n"
                + "00:00:00,000 --> 00:00:05,200\n"
                + "[Speaker A] Hello world\n"
                + "\n"
                + "2\n"
                + "00:00:05,200 --> 00:00:10,300\n"
                + "[Speaker B] This is a test\n");
  }

  @Test
  void writeVtt_shouldStartWithHeaderAndUsePeriodSeparator() {
    String vtt = formatter.writeVtt(utterances);

    assertThat(vtt)
        .isEqualTo(
            "WEBVTT\n"
                + "\n"
                + "00:00:00.000 --> 00:00:05.200\n"
                + "[Speaker A] Hello world\n"
                + "\n"
                + "00:00:05.200 --> 00:00:10.300\n"
                + "[Speaker B] This is a test\n");
  }

  @Test
  void writeText_shouldWriteOneLinePerUtterance() {
    assertThat(formatter.writeText(utterances))
        .isEqualTo(
            "[00:00:00,000] Speaker A: Hello world\n"
                + "[00:00:05,200] Speaker B: This is a test");
  }

  @Test
  void writeJson_shouldUseSnakeCaseKeysAndOmitMissingEnhancements() throws Exception {
    JsonNode json = objectMapper.readTree(formatter.writeJson(utterances, 12.5, 2, null));

    assertThat(json.has("llm_enhancements")).isFalse();
    assertThat(json.get("audio_duration").asDouble()).isEqualTo(12.5);
    assertThat(json.get("speakers_detected").asInt()).isEqualTo(2);
    assertThat(json.get("utterances")).hasSize(2);
    JsonNode first = json.get("utterances").get(0);
    assertThat(first.get("speaker").asText()).isEqualTo("Speaker A");
    assertThat(first.get("end").asDouble()).isEqualTo(5.2);
    assertThat(first.get("confidence").asDouble()).isEqualTo(0.9);
    assertThat(json.get("utterances").get(1).get("confidence").isNull()).isTrue();
  }

  @Test
  void writeJson_shouldIncludeEnhancementsWithNullFields() throws Exception {
    LlmEnhancements enhancements = new LlmEnhancements("A short call.", null, "testing");

    JsonNode json = objectMapper.readTree(formatter.writeJson(utterances, 12.5, 2, enhancements));

    JsonNode llm = json.get("llm_enhancements");
    assertThat(llm.get("summary").asText()).isEqualTo("A short call.");
    assertThat(llm.get("action_items").isNull()).isTrue();
    assertThat(llm.get("topics").asText()).isEqualTo("testing");
  }

  @Test
  void writeJson_shouldKeepKeyOrder() throws Exception {
    String json = formatter.writeJson(List.of(), 1.0, 0, null);

    assertThat(json)
        .isEqualTo("{\"utterances\":[],\"audio_duration\":1.0,\"speakers_detected\":0}");
  }

  @Test
  void emptyTranscripts_shouldRenderMinimalDocuments() throws Exception {
    assertThat(formatter.format(ResponseFormat.SRT, List.of(), 0.0, 0, null)).isEmpty();
    assertThat(formatter.format(ResponseFormat.VTT, List.of(), 0.0, 0, null))
        .isEqualTo("WEBVTT\n");
    assertThat(formatter.format(ResponseFormat.TEXT, List.of(), 0.0, 0, null)).isEmpty();
  }

  @Test
  void format_shouldBeDeterministic() throws Exception {
    for (ResponseFormat format : ResponseFormat.values()) {
      String first = formatter.format(format, utterances, 10.3, 2, null);
      String second = formatter.format(format, utterances, 10.3, 2, null);
      assertThat(first).isEqualTo(second);
    }
  }
}
