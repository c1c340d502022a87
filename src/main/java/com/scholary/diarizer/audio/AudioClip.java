package com.scholary.diarizer.audio;

/**
 * Padded slice of the recording cut for one diarization turn.
 *
 * <p>{@code start} and {@code end} are the turn's own bounds in seconds. The sample indices
 * include the padding, so {@code samples} may hold audio from slightly before and after the turn.
 */
public record AudioClip(
    float[] samples, double start, double end, String speaker, int startSample, int endSample) {}
