package com.scholary.diarizer.audio;

import java.nio.file.Path;

/** A normalized 16-bit mono WAV file and the duration of the source recording. */
public record PreprocessedAudio(Path path, double durationSeconds) {}
