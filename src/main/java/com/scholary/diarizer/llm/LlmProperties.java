package com.scholary.diarizer.llm;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Ollama client.
 *
 * <p>Timeouts are in seconds. {@code maxTranscriptChars} caps how much transcript text is put in
 * each prompt.
 */
@ConfigurationProperties(prefix = "llm")
@Validated
public record LlmProperties(
    boolean enabled,
    @NotBlank String baseUrl,
    @NotBlank String model,
    @Positive int availabilityTimeout,
    @Positive int readTimeout,
    @Positive int maxTranscriptChars) {}
