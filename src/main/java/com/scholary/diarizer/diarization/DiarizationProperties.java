package com.scholary.diarizer.diarization;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the diarization service client.
 *
 * <p>{@code mode} selects the HTTP client ({@code http}) or the deterministic stub ({@code stub}).
 * Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "diarization")
@Validated
public record DiarizationProperties(
    @NotBlank String mode,
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
