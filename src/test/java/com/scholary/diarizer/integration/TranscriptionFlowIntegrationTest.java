package com.scholary.diarizer.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.diarizer.audio.AudioPreprocessor;
import com.scholary.diarizer.audio.PreprocessedAudio;
import com.scholary.diarizer.audio.WavEncoder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Runs a job through the whole application with the stub diarizer and transcriber.
 *
 * <p>ffmpeg is replaced by a preprocessor that writes a silent WAV of known length.
 */
@SpringBootTest
@AutoConfigureMockMvc
class TranscriptionFlowIntegrationTest {

  private static final int SAMPLE_RATE = 16000;
  private static final double DURATION_SECONDS = 16.0;

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @MockBean private AudioPreprocessor preprocessor;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) throws IOException {
    Path uploadDir = Files.createTempDirectory("diarizer-it-");
    registry.add("pipeline.uploadDir", uploadDir::toString);
    registry.add("diarization.mode", () -> "stub");
    registry.add("whisper.mode", () -> "stub");
    registry.add("llm.enabled", () -> "false");
  }

  @Test
  void uploadedRecording_shouldCompleteWithSpeakerAttributedTranscript() throws Exception {
    when(preprocessor.outputPathFor(any()))
        .thenAnswer(
            invocation -> {
              Path source = invocation.getArgument(0);
              return source.resolveSibling("processed_" + source.getFileName() + ".wav");
            });
    when(preprocessor.preprocess(any()))
        .thenAnswer(
            invocation -> {
              Path source = invocation.getArgument(0);
              Path output = preprocessor.outputPathFor(source);
              float[] silence = new float[(int) (DURATION_SECONDS * SAMPLE_RATE)];
              Files.write(output, WavEncoder.encode(silence, SAMPLE_RATE));
              return new PreprocessedAudio(output, DURATION_SECONDS);
            });

    String accepted =
        mockMvc
            .perform(
                multipart("/api/transcribe")
                    .file(
                        new MockMultipartFile(
                            "file", "standup.mp3", "audio/mpeg", new byte[] {1, 2, 3, 4}))
                    .param("expectedSpeakers", "2"))
            .andExpect(status().isAccepted())
            .andReturn()
            .getResponse()
            .getContentAsString();
    String jobId = objectMapper.readTree(accepted).get("jobId").asText();

    JsonNode job = awaitTerminal(jobId);

    assertThat(job.get("status").asText()).isEqualTo("completed");
    assertThat(job.get("progressPercent").asInt()).isEqualTo(100);
    JsonNode result = job.get("result");
    assertThat(result.get("speakers_detected").asInt()).isEqualTo(2);
    assertThat(result.get("audio_duration").asDouble()).isEqualTo(DURATION_SECONDS);
    assertThat(result.get("utterances")).hasSize(8);
    assertThat(result.get("utterances").get(0).get("speaker").asText()).isEqualTo("Speaker A");
    assertThat(result.get("utterances").get(1).get("speaker").asText()).isEqualTo("Speaker B");
    assertThat(result.has("llm_enhancements")).isFalse();
  }

  private JsonNode awaitTerminal(String jobId) throws Exception {
    long deadline = System.currentTimeMillis() + 20_000;
    while (true) {
      String body =
          mockMvc
              .perform(get("/api/jobs/" + jobId))
              .andExpect(status().isOk())
              .andReturn()
              .getResponse()
              .getContentAsString();
      JsonNode job = objectMapper.readTree(body);
      String status = job.get("status").asText();
      if (status.equals("completed") || status.equals("failed")) {
        return job;
      }
      assertThat(System.currentTimeMillis())
          .as("job %s still %s", jobId, status)
          .isLessThan(deadline);
      Thread.sleep(100);
    }
  }
}
