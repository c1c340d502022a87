package com.scholary.diarizer.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.diarizer.audio.WavEncoder;
import com.scholary.diarizer.client.MultipartBody;
import com.scholary.diarizer.client.RetryingHttpCaller;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * HTTP client for calling the faster-whisper transcription API.
 *
 * <p>Each clip is encoded as a 16-bit mono WAV in memory and posted as multipart/form-data with
 * word timestamps requested. Transient failures are retried with exponential backoff.
 */
@Component
@ConditionalOnProperty(name = "whisper.mode", havingValue = "http", matchIfMissing = true)
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;
  private final RetryingHttpCaller retrying;

  @Autowired
  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  WhisperClient(WhisperProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    this.retrying = new RetryingHttpCaller(LOGGER, "Transcription", properties.maxRetries());

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, language={}",
        properties.baseUrl(),
        properties.language());
  }

  @Override
  public WhisperResponse transcribe(float[] samples, int sampleRate, int clipIndex) {
    LOGGER.debug(
        "Transcribing clip: index={}, duration={}s",
        clipIndex,
        samples.length / (double) sampleRate);

    byte[] wav = WavEncoder.encode(samples, sampleRate);
    return retrying.call(
        () -> attemptTranscribe(wav, clipIndex),
        failure -> new WhisperException(clipIndex, failure.message(), failure.cause()));
  }

  @Override
  public String name() {
    return "http";
  }

  private WhisperResponse attemptTranscribe(byte[] wav, int clipIndex)
      throws IOException, InterruptedException {
    MultipartBody body =
        new MultipartBody()
            .file("file", "clip_" + clipIndex + ".wav", "audio/wav", wav)
            .field("word_timestamps", "true")
            .field("language", properties.language());

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", body.contentType())
            .POST(body.publisher())
            .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);
    LOGGER.debug(
        "Transcription successful: clip={}, words={}", clipIndex, whisperResponse.words().size());
    return whisperResponse;
  }
}
