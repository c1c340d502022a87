package com.scholary.diarizer.audio;

import com.scholary.diarizer.config.PipelineProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes uploads with ffmpeg.
 *
 * <p>Two steps:
 *
 * <ol>
 *   <li>ffprobe reads the duration, so an over-long recording is rejected before any decoding
 *   <li>ffmpeg applies loudness normalization and writes 16-bit mono PCM at the pipeline sample
 *       rate
 * </ol>
 *
 * <p>The output is written next to the upload as {@code processed_<name>.wav}.
 */
@Component
public class FfmpegAudioPreprocessor implements AudioPreprocessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioPreprocessor.class);

  private static final int MAX_LOGGED_OUTPUT_CHARS = 2000;

  private final FfmpegProperties ffmpeg;
  private final int sampleRate;
  private final int maxDurationSeconds;

  public FfmpegAudioPreprocessor(FfmpegProperties ffmpeg, PipelineProperties pipeline) {
    this.ffmpeg = ffmpeg;
    this.sampleRate = pipeline.sampleRate();
    this.maxDurationSeconds = pipeline.maxAudioDurationSeconds();
  }

  @Override
  public PreprocessedAudio preprocess(Path source) {
    if (!Files.isRegularFile(source)) {
      throw new AudioProcessingException("Audio file not found: " + source);
    }

    double duration = probeDuration(source);
    if (duration > maxDurationSeconds) {
      throw new AudioValidationException(
          String.format(
              "Audio duration %.1fs exceeds maximum %ds", duration, maxDurationSeconds));
    }

    Path output = outputPathFor(source);
    LOGGER.info(
        "Normalizing audio: source={}, duration={}s, sampleRate={}",
        source.getFileName(),
        duration,
        sampleRate);

    // -af loudnorm: EBU R128 loudness normalization
    // -ac 1 -ar N: downmix to mono and resample
    // -c:a pcm_s16le -f wav: 16-bit little-endian PCM in a WAV container
    run(
        List.of(
            ffmpeg.ffmpegPath(),
            "-hide_banner",
            "-nostdin",
            "-y",
            "-i",
            source.toString(),
            "-af",
            "loudnorm",
            "-ac",
            "1",
            "-ar",
            String.valueOf(sampleRate),
            "-c:a",
            "pcm_s16le",
            "-f",
            "wav",
            output.toString()),
        "ffmpeg normalization");

    if (!Files.isRegularFile(output)) {
      throw new AudioProcessingException("ffmpeg produced no output for " + source.getFileName());
    }
    return new PreprocessedAudio(output, duration);
  }

  @Override
  public Path outputPathFor(Path source) {
    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return source.resolveSibling("processed_" + base + ".wav");
  }

  /**
   * Read the container duration with ffprobe.
   *
   * @throws AudioProcessingException if ffprobe fails or reports no duration
   */
  double probeDuration(Path source) {
    String output =
        run(
            List.of(
                ffmpeg.ffprobePath(),
                "-v",
                "error",
                "-show_entries",
                "format=duration",
                "-of",
                "default=noprint_wrappers=1:nokey=1",
                source.toString()),
            "ffprobe");

    String value = output.trim();
    try {
      double duration = Double.parseDouble(value);
      if (!(duration > 0)) {
        throw new AudioProcessingException(
            "ffprobe reported a non-positive duration for " + source.getFileName());
      }
      return duration;
    } catch (NumberFormatException e) {
      throw new AudioProcessingException(
          "Could not read audio duration from ffprobe output: " + abbreviate(value), e);
    }
  }

  /** Run a command to completion and return its combined stdout and stderr. */
  private String run(List<String> command, String step) {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path log = null;
    Process process = null;
    try {
      log = Files.createTempFile("diarizer-ffmpeg-", ".log");
      process =
          new ProcessBuilder(command)
              .redirectErrorStream(true)
              .redirectOutput(log.toFile())
              .start();

      if (!process.waitFor(ffmpeg.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new AudioProcessingException(
            String.format("%s timed out after %ds", step, ffmpeg.timeoutSeconds()));
      }

      String output = Files.readString(log, StandardCharsets.UTF_8);
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        LOGGER.warn("{} exited with code {}: {}", step, exitCode, abbreviate(output));
        throw new AudioProcessingException(
            String.format("%s failed with exit code %d: %s", step, exitCode, lastLine(output)));
      }
      return output;

    } catch (IOException e) {
      throw new AudioProcessingException(step + " could not be run: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (process != null) {
        process.destroyForcibly();
      }
      throw new AudioProcessingException(step + " interrupted", e);
    } finally {
      if (log != null) {
        try {
          Files.deleteIfExists(log);
        } catch (IOException e) {
          LOGGER.debug("Could not delete ffmpeg log {}: {}", log, e.getMessage());
        }
      }
    }
  }

  private static String lastLine(String output) {
    String trimmed = output.strip();
    int newline = trimmed.lastIndexOf('\n');
    return newline >= 0 ? trimmed.substring(newline + 1) : trimmed;
  }

  private static String abbreviate(String text) {
    return text.length() <= MAX_LOGGED_OUTPUT_CHARS
        ? text
        : text.substring(text.length() - MAX_LOGGED_OUTPUT_CHARS);
  }
}
