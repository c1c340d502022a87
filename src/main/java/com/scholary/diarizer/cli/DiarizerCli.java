package com.scholary.diarizer.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.scholary.diarizer.output.ResponseFormat;
import java.io.IOException;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * Command-line client: submit a recording, follow its progress and save the transcript.
 *
 * <p>Runs outside the Spring context and talks to a running service over HTTP. Exit code is 0 on
 * success, 1 on a failed job or unreachable service, 2 on bad arguments.
 */
public class DiarizerCli {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private final PrintStream out;
  private final PrintStream err;
  private final Function<String, DiarizerApiClient> clientFactory;
  private final ObjectMapper objectMapper;

  DiarizerCli(
      PrintStream out,
      PrintStream err,
      Function<String, DiarizerApiClient> clientFactory,
      ObjectMapper objectMapper) {
    this.out = out;
    this.err = err;
    this.clientFactory = clientFactory;
    this.objectMapper = objectMapper;
  }

  public static void main(String[] args) {
    ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    HttpClient httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    DiarizerCli cli =
        new DiarizerCli(
            System.out,
            System.err,
            server -> new DiarizerApiClient(server, httpClient, objectMapper),
            objectMapper);
    System.exit(cli.run(args));
  }

  int run(String... args) {
    CliOptions options;
    try {
      options = CliOptions.parse(args);
    } catch (CliUsageException e) {
      err.println("Error: " + e.getMessage());
      err.println(CliOptions.USAGE);
      return EXIT_USAGE;
    }

    DiarizerApiClient client = clientFactory.apply(options.server());
    try {
      if (options.healthCheck()) {
        JsonNode health = client.health();
        if (!options.quiet()) {
          out.println("Server health:");
          out.println(objectMapper.writeValueAsString(health));
        }
        return EXIT_OK;
      }
      return transcribe(client, options);

    } catch (IOException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_FAILED;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      err.println("Cancelled");
      return EXIT_FAILED;
    }
  }

  private int transcribe(DiarizerApiClient client, CliOptions options)
      throws IOException, InterruptedException {
    Path audioFile = options.audioFile();
    if (!Files.isRegularFile(audioFile)) {
      err.println("Error: Audio file not found: " + audioFile);
      return EXIT_FAILED;
    }
    Path output = options.outputOrDefault();

    if (!options.quiet()) {
      out.println("Submitting audio file: " + audioFile);
      out.println(
          "Expected speakers: "
              + (options.expectedSpeakers() == null ? "auto-detect" : options.expectedSpeakers()));
      out.println("Output format: " + options.format().value());
      out.println("LLM analysis: " + (options.llmAnalysis() ? "enabled" : "disabled"));
      out.println("Output file: " + output);
      out.println();
    }

    String jobId = client.submit(audioFile, options);
    if (!options.quiet()) {
      out.println("Job submitted: " + jobId);
    }

    JsonNode job =
        client.awaitCompletion(
            jobId,
            options.pollInterval(),
            status -> {
              if (!options.quiet()) {
                out.println(describeProgress(status));
              }
            });

    Files.writeString(output, renderOutput(job, options.format()), StandardCharsets.UTF_8);
    if (!options.quiet()) {
      out.println("Transcription saved to: " + output);
      printSummary(job.path("result"));
    }
    return EXIT_OK;
  }

  /** JSON jobs are saved as the whole status document; other formats as the bare transcript. */
  String renderOutput(JsonNode job, ResponseFormat format) throws IOException {
    JsonNode result = job.path("result");
    if (format != ResponseFormat.JSON && result.isTextual()) {
      return result.asText();
    }
    return objectMapper.writeValueAsString(job);
  }

  private static String describeProgress(JsonNode status) {
    String progress = status.path("progress").asText(status.path("status").asText());
    JsonNode percent = status.path("progressPercent");
    if (percent.isNumber()) {
      return String.format("  [%3d%%] %s", percent.asInt(), progress);
    }
    return "  Status: " + progress;
  }

  private void printSummary(JsonNode result) {
    if (!result.isObject()) {
      return;
    }
    if (result.has("audio_duration")) {
      out.println(
          String.format(
              Locale.ROOT, "  Audio duration: %.1fs", result.get("audio_duration").asDouble()));
    }
    if (result.has("speakers_detected")) {
      out.println("  Speakers detected: " + result.get("speakers_detected").asInt());
    }
    if (result.has("utterances")) {
      out.println("  Utterances: " + result.get("utterances").size());
    }
    if (result.has("llm_enhancements")) {
      out.println("  LLM analysis included");
    }
  }
}
