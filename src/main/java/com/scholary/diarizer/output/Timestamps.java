package com.scholary.diarizer.output;

import java.util.Locale;

/**
 * Timecode formatting shared by the subtitle and text renderers.
 *
 * <p>Format: HH:MM:SS{sep}mmm. Hours, minutes and seconds are two-digit zero-padded, milliseconds
 * three-digit. Hours are not wrapped at 24.
 */
public final class Timestamps {

  private Timestamps() {}

  /** SRT and plain-text timecode, e.g. {@code 00:02:05,500}. */
  public static String srt(double seconds) {
    return format(seconds, ',');
  }

  /** WebVTT timecode, e.g. {@code 00:02:05.500}. */
  public static String vtt(double seconds) {
    return format(seconds, '.');
  }

  static String format(double seconds, char millisSeparator) {
    // Round once to whole milliseconds so 5.2 renders as 05,200 rather than 05,199
    long totalMillis = Math.round(Math.max(0.0, seconds) * 1000.0);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format(
        Locale.ROOT, "%02d:%02d:%02d%c%03d", hours, minutes, secs, millisSeparator, millis);
  }
}
