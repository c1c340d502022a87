package com.scholary.diarizer.api;

import com.scholary.diarizer.diarization.SpeakerDiarizer;
import com.scholary.diarizer.llm.TranscriptEnhancer;
import com.scholary.diarizer.whisper.WhisperService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Health and collaborator status. */
@RestController
@RequestMapping("/api")
@Tag(name = "Status", description = "Service health")
public class ServiceStatusController {

  private final SpeakerDiarizer diarizer;
  private final WhisperService whisperService;
  private final TranscriptEnhancer enhancer;

  public ServiceStatusController(
      SpeakerDiarizer diarizer, WhisperService whisperService, TranscriptEnhancer enhancer) {
    this.diarizer = diarizer;
    this.whisperService = whisperService;
    this.enhancer = enhancer;
  }

  @GetMapping("/health")
  @Operation(summary = "Service health and active collaborator variants")
  public Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("service", "speaker-diarizer");
    health.put("diarizer", diarizer.name());
    health.put("transcriber", whisperService.name());
    health.put("llmEnabled", enhancer.isEnabled());
    health.put("llmAvailable", enhancer.isEnabled() && enhancer.isAvailable());
    return health;
  }

  @GetMapping("/llm/status")
  @Operation(summary = "LLM server status")
  public Map<String, Object> llmStatus() {
    Map<String, Object> status = new LinkedHashMap<>();
    if (!enhancer.isEnabled()) {
      status.put("enabled", false);
      status.put("available", false);
      status.put("message", "LLM integration is disabled");
      return status;
    }

    boolean available = enhancer.isAvailable();
    status.put("enabled", true);
    status.put("available", available);
    status.put("model", enhancer.model());
    status.put(
        "message", available ? "LLM server is available" : "LLM server is not responding");
    return status;
  }
}
