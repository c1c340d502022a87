package com.scholary.diarizer.diarization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.diarizer.client.MultipartBody;
import com.scholary.diarizer.client.RetryingHttpCaller;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the speaker diarization service.
 *
 * <p>Uploads the normalized WAV to {@code POST {baseUrl}/api/v1/diarize} and returns the segments
 * with the service's own speaker labels. Segments with missing or inverted bounds are dropped.
 */
@Component
@ConditionalOnProperty(name = "diarization.mode", havingValue = "http", matchIfMissing = true)
public class HttpSpeakerDiarizer implements SpeakerDiarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeakerDiarizer.class);

  private final HttpClient httpClient;
  private final DiarizationProperties properties;
  private final ObjectMapper objectMapper;
  private final RetryingHttpCaller retrying;

  @Autowired
  public HttpSpeakerDiarizer(DiarizationProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  HttpSpeakerDiarizer(
      DiarizationProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    this.retrying = new RetryingHttpCaller(LOGGER, "Diarization", properties.maxRetries());

    LOGGER.info("Initialized diarization client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public List<DiarizationTurn> diarize(Path audioFile, Integer expectedSpeakers) {
    LOGGER.info(
        "Diarizing: file={}, expectedSpeakers={}", audioFile.getFileName(), expectedSpeakers);

    DiarizationResponse response =
        retrying.call(
            () -> attemptDiarize(audioFile, expectedSpeakers),
            failure -> new DiarizationException(failure.message(), failure.cause()));

    List<DiarizationTurn> turns = toTurns(response);
    LOGGER.info("Diarization returned {} turns", turns.size());
    return turns;
  }

  @Override
  public String name() {
    return "http";
  }

  private DiarizationResponse attemptDiarize(Path audioFile, Integer expectedSpeakers)
      throws IOException, InterruptedException {
    MultipartBody body =
        new MultipartBody()
            .file(
                "file",
                audioFile.getFileName().toString(),
                "audio/wav",
                Files.readAllBytes(audioFile));
    if (expectedSpeakers != null) {
      body.field("num_speakers", String.valueOf(expectedSpeakers));
    }

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/diarize"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", body.contentType())
            .POST(body.publisher())
            .build();

    LOGGER.debug("Sending diarization request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Diarization API returned status %d: %s", response.statusCode(), response.body()));
    }
    return objectMapper.readValue(response.body(), DiarizationResponse.class);
  }

  private static List<DiarizationTurn> toTurns(DiarizationResponse response) {
    List<DiarizationTurn> turns = new ArrayList<>();
    if (response == null || response.segments() == null) {
      return turns;
    }
    for (DiarizationResponse.Segment segment : response.segments()) {
      if (segment.start() == null
          || segment.end() == null
          || segment.speaker() == null
          || segment.start() < 0
          || segment.start() >= segment.end()) {
        LOGGER.warn("Skipping invalid diarization segment: {}", segment);
        continue;
      }
      turns.add(new DiarizationTurn(segment.start(), segment.end(), segment.speaker()));
    }
    return turns;
  }
}
