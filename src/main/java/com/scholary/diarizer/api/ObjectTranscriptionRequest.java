package com.scholary.diarizer.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to transcribe a recording that is already in the object store.
 *
 * <p>{@code bucket} defaults to the configured bucket, {@code responseFormat} to json and
 * {@code enableLlmAnalysis} to false.
 */
public record ObjectTranscriptionRequest(
    String bucket,
    @NotBlank String key,
    @Min(2) @Max(10) Integer expectedSpeakers,
    String responseFormat,
    Boolean enableLlmAnalysis) {}
