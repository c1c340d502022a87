package com.scholary.diarizer.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the diarization pipeline.
 *
 * <p>Controls where uploads live, the sample rate clips are cut at, the padding and merge
 * tolerances, the submission limits and the size of the worker pool.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String uploadDir,
    @Positive int sampleRate,
    @PositiveOrZero double paddingSeconds,
    @PositiveOrZero double mergeGapSeconds,
    @Positive int maxAudioDurationSeconds,
    @Positive long maxFileSizeBytes,
    @Positive int workerThreads,
    @Positive int workerQueueCapacity) {}
