package com.scholary.diarizer.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for Whisper API client.
 *
 * <p>These control how we connect to the Whisper service (or stub), the language requested for
 * every clip, and timeouts/retries.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String mode,
    @NotBlank String baseUrl,
    @NotBlank String language,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
