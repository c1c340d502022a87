package com.scholary.diarizer.transcript;

/**
 * A single recognized word with its position on the recording's timeline.
 *
 * <p>Times are absolute seconds from the start of the recording, not relative to the clip the word
 * was recognized in.
 */
public record WordTimestamp(String word, double start, double end, double probability) {}
