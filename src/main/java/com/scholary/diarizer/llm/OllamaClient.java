package com.scholary.diarizer.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.diarizer.transcript.TranscribedSegment;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * HTTP client for an Ollama server.
 *
 * <p>Makes three sequential completion calls per transcript (summary, action items, topics) so a
 * single model server is never asked for more than one completion at a time. A failed call leaves
 * its field null; the other calls still run.
 */
@Component
@ConditionalOnProperty(name = "llm.enabled", havingValue = "true")
public class OllamaClient implements TranscriptEnhancer {

  private static final Logger LOGGER = LoggerFactory.getLogger(OllamaClient.class);

  static final String SUMMARY_PROMPT =
      "Please provide a concise summary of this meeting transcript. Focus on:\n"
          + "1. Key topics discussed\n"
          + "2. Main decisions made\n"
          + "3. Action items or next steps\n"
          + "4. Important points raised by each speaker\n"
          + "\n"
          + "Transcript:\n"
          + "%s\n"
          + "\n"
          + "Summary:";

  static final String ACTION_ITEMS_PROMPT =
      "Extract all action items, tasks, and next steps from this meeting transcript. "
          + "Format as a bullet-point list.\n"
          + "\n"
          + "Transcript:\n"
          + "%s\n"
          + "\n"
          + "Action Items:";

  static final String TOPICS_PROMPT =
      "Identify the main topics and themes discussed in this meeting transcript. "
          + "List them as bullet points.\n"
          + "\n"
          + "Transcript:\n"
          + "%s\n"
          + "\n"
          + "Main Topics:";

  private final HttpClient httpClient;
  private final LlmProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public OllamaClient(LlmProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.availabilityTimeout()))
            .build());
  }

  OllamaClient(LlmProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;

    LOGGER.info(
        "Initialized Ollama client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  public boolean isAvailable() {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/tags"))
            .timeout(Duration.ofSeconds(properties.availabilityTimeout()))
            .GET()
            .build();
    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      return response.statusCode() == 200;
    } catch (IOException e) {
      LOGGER.debug("Ollama availability check failed: {}", e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public Optional<LlmEnhancements> enhance(List<TranscribedSegment> utterances) {
    String transcript = formatTranscript(utterances, properties.maxTranscriptChars());

    String summary = generate(String.format(SUMMARY_PROMPT, transcript), 0.1);
    String actionItems = generate(String.format(ACTION_ITEMS_PROMPT, transcript), 0.1);
    String topics = generate(String.format(TOPICS_PROMPT, transcript), 0.2);

    LlmEnhancements enhancements = new LlmEnhancements(summary, actionItems, topics);
    return enhancements.isEmpty() ? Optional.empty() : Optional.of(enhancements);
  }

  @Override
  public String model() {
    return properties.model();
  }

  /**
   * Request one non-streamed completion.
   *
   * @return the trimmed response text, or null if the call failed or returned nothing
   */
  String generate(String prompt, double temperature) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("model", properties.model());
    payload.put("prompt", prompt);
    payload.put("stream", false);
    ObjectNode options = payload.putObject("options");
    options.put("temperature", temperature);
    options.put("top_p", 0.9);
    options.put("top_k", 40);

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/api/generate"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        LOGGER.error("Ollama API error: {} {}", response.statusCode(), response.body());
        return null;
      }

      JsonNode body = objectMapper.readTree(response.body());
      String text = body.path("response").asText("").strip();
      return text.isEmpty() ? null : text;

    } catch (IOException e) {
      LOGGER.error("Ollama completion failed: {}", e.getMessage());
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.error("Ollama completion interrupted");
      return null;
    }
  }

  /**
   * Render utterances as {@code speaker: text} lines, stopping before the first line that would
   * take the text past {@code maxChars}.
   */
  static String formatTranscript(List<TranscribedSegment> utterances, int maxChars) {
    List<String> lines = new ArrayList<>();
    int length = 0;
    for (TranscribedSegment utterance : utterances) {
      String line = utterance.speaker() + ": " + utterance.text();
      if (length + line.length() > maxChars) {
        break;
      }
      lines.add(line);
      length += line.length() + 1;
    }
    return String.join("\n", lines);
  }
}
