package com.scholary.diarizer.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.diarizer.client.MultipartBody;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * HTTP client for the job API, used by the command-line tool.
 *
 * <p>Submits a recording, polls {@code /api/jobs/{id}} until the job is terminal and returns the
 * final status document.
 */
public class DiarizerApiClient {

  private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(5);

  private static final Map<String, String> AUDIO_TYPES =
      Map.of(
          "mp3", "audio/mpeg",
          "wav", "audio/wav",
          "m4a", "audio/mp4",
          "flac", "audio/flac",
          "ogg", "audio/ogg",
          "webm", "audio/webm");

  private final String baseUrl;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public DiarizerApiClient(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper) {
    this.baseUrl = baseUrl;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  /**
   * Upload a recording and return the id of the queued job.
   *
   * @throws IOException if the file cannot be read or the service rejects the submission
   */
  public String submit(Path audioFile, CliOptions options)
      throws IOException, InterruptedException {
    MultipartBody body =
        new MultipartBody()
            .file(
                "file",
                audioFile.getFileName().toString(),
                audioTypeOf(audioFile),
                Files.readAllBytes(audioFile))
            .field("responseFormat", options.format().value())
            .field("enableLlmAnalysis", String.valueOf(options.llmAnalysis()));
    if (options.expectedSpeakers() != null) {
      body.field("expectedSpeakers", String.valueOf(options.expectedSpeakers()));
    }

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/api/transcribe"))
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", body.contentType())
            .POST(body.publisher())
            .build();

    JsonNode accepted = send(request, 202);
    return accepted.path("jobId").asText();
  }

  /** Current status document of a job. */
  public JsonNode status(String jobId) throws IOException, InterruptedException {
    return send(get("/api/jobs/" + jobId), 200);
  }

  /** Service health document. */
  public JsonNode health() throws IOException, InterruptedException {
    return send(get("/api/health"), 200);
  }

  /**
   * Poll a job until it completes.
   *
   * @param onProgress receives every non-terminal status document
   * @return the completed status document, including the result
   * @throws IOException if the job failed or the service could not be reached
   */
  public JsonNode awaitCompletion(
      String jobId, Duration pollInterval, Consumer<JsonNode> onProgress)
      throws IOException, InterruptedException {
    while (true) {
      JsonNode job = status(jobId);
      String status = job.path("status").asText();
      if (status.equals("completed")) {
        return job;
      }
      if (status.equals("failed")) {
        throw new IOException("Job failed: " + job.path("error").asText("Unknown error"));
      }
      onProgress.accept(job);
      Thread.sleep(pollInterval.toMillis());
    }
  }

  static String audioTypeOf(Path audioFile) {
    String name = audioFile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String extension = dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    return AUDIO_TYPES.getOrDefault(extension, "audio/mpeg");
  }

  private HttpRequest get(String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .timeout(REQUEST_TIMEOUT)
        .GET()
        .build();
  }

  private JsonNode send(HttpRequest request, int expectedStatus)
      throws IOException, InterruptedException {
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != expectedStatus) {
      throw new IOException(
          String.format(
              "%s %s returned status %d: %s",
              request.method(), request.uri().getPath(), response.statusCode(), response.body()));
    }
    return objectMapper.readTree(response.body());
  }
}
