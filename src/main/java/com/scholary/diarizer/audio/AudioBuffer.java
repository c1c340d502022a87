package com.scholary.diarizer.audio;

/**
 * Mono samples in the range [-1, 1].
 *
 * <p>The array is shared, not copied; callers must not modify it.
 */
public record AudioBuffer(float[] samples, int sampleRate) {}
