package com.scholary.diarizer.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.diarizer.output.ResponseFormat;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CliOptionsTest {

  @Test
  void parse_shouldApplyDefaults() {
    CliOptions options = CliOptions.parse("meeting.mp3");

    assertThat(options.audioFile()).isEqualTo(Path.of("meeting.mp3"));
    assertThat(options.expectedSpeakers()).isNull();
    assertThat(options.format()).isEqualTo(ResponseFormat.JSON);
    assertThat(options.llmAnalysis()).isFalse();
    assertThat(options.server()).isEqualTo("http://localhost:8080");
    assertThat(options.pollInterval()).isEqualTo(Duration.ofSeconds(5));
    assertThat(options.quiet()).isFalse();
    assertThat(options.outputOrDefault()).isEqualTo(Path.of("meeting_transcript.json"));
  }

  @Test
  void parse_shouldReadEveryOption() {
    CliOptions options =
        CliOptions.parse(
            "-s", "3", "--format", "SRT", "--llm-analysis", "-o", "out/subs.srt",
            "--server", "http://diarizer:8080/", "--poll-interval", "2", "-q", "call.wav");

    assertThat(options.expectedSpeakers()).isEqualTo(3);
    assertThat(options.format()).isEqualTo(ResponseFormat.SRT);
    assertThat(options.llmAnalysis()).isTrue();
    assertThat(options.outputOrDefault()).isEqualTo(Path.of("out/subs.srt"));
    assertThat(options.server()).isEqualTo("http://diarizer:8080");
    assertThat(options.pollInterval()).isEqualTo(Duration.ofSeconds(2));
    assertThat(options.quiet()).isTrue();
    assertThat(options.audioFile()).isEqualTo(Path.of("call.wav"));
  }

  @Test
  void outputOrDefault_shouldUseFormatAsExtension() {
    assertThat(CliOptions.parse("-f", "vtt", "standup.m4a").outputOrDefault())
        .isEqualTo(Path.of("standup_transcript.vtt"));
    assertThat(CliOptions.parse("-f", "text", "recording").outputOrDefault())
        .isEqualTo(Path.of("recording_transcript.text"));
  }

  @Test
  void parse_shouldAllowHealthCheckWithoutAudioFile() {
    CliOptions options = CliOptions.parse("--health");

    assertThat(options.healthCheck()).isTrue();
    assertThat(options.audioFile()).isNull();
  }

  @Test
  void parse_shouldRequireAudioFile() {
    assertThatThrownBy(() -> CliOptions.parse("-s", "2"))
        .isInstanceOf(CliUsageException.class)
        .hasMessageContaining("Audio file is required");
  }

  @Test
  void parse_shouldRejectUnknownOption() {
    assertThatThrownBy(() -> CliOptions.parse("--verbose", "a.mp3"))
        .isInstanceOf(CliUsageException.class)
        .hasMessage("Unknown option: --verbose");
  }

  @Test
  void parse_shouldRejectMissingOptionValue() {
    assertThatThrownBy(() -> CliOptions.parse("a.mp3", "--speakers"))
        .isInstanceOf(CliUsageException.class)
        .hasMessage("Missing value for --speakers");
  }

  @Test
  void parse_shouldRejectNonNumericSpeakers() {
    assertThatThrownBy(() -> CliOptions.parse("-s", "two", "a.mp3"))
        .isInstanceOf(CliUsageException.class)
        .hasMessage("-s expects a number, got: two");
  }

  @Test
  void parse_shouldRejectUnknownFormat() {
    assertThatThrownBy(() -> CliOptions.parse("-f", "docx", "a.mp3"))
        .isInstanceOf(CliUsageException.class)
        .hasMessageContaining("Unsupported response format: docx");
  }

  @Test
  void parse_shouldRejectZeroPollInterval() {
    assertThatThrownBy(() -> CliOptions.parse("--poll-interval", "0", "a.mp3"))
        .isInstanceOf(CliUsageException.class)
        .hasMessageContaining("at least 1 second");
  }

  @Test
  void parse_shouldRejectSecondAudioFile() {
    assertThatThrownBy(() -> CliOptions.parse("a.mp3", "b.mp3"))
        .isInstanceOf(CliUsageException.class)
        .hasMessage("Only one audio file can be submitted");
  }
}
