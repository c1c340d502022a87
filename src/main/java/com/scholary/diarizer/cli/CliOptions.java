package com.scholary.diarizer.cli;

import com.scholary.diarizer.output.ResponseFormat;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Parsed arguments of the command-line client.
 *
 * <pre>
 * diarizer-cli [options] &lt;audio-file&gt;
 *   -o, --output &lt;file&gt;        where to save the result
 *                              (default: &lt;name&gt;_transcript.&lt;format&gt;)
 *   -s, --speakers &lt;n&gt;         expected number of speakers (2-10)
 *   -f, --format &lt;format&gt;      json, srt, vtt or text (default: json)
 *       --llm-analysis         request summary, action items and topics
 *       --server &lt;url&gt;         service base URL (default: http://localhost:8080)
 *       --poll-interval &lt;s&gt;    seconds between status polls (default: 5)
 *       --health               print the service health and exit
 *   -q, --quiet                only report errors
 * </pre>
 */
public record CliOptions(
    Path audioFile,
    Path output,
    Integer expectedSpeakers,
    ResponseFormat format,
    boolean llmAnalysis,
    String server,
    Duration pollInterval,
    boolean healthCheck,
    boolean quiet) {

  static final String DEFAULT_SERVER = "http://localhost:8080";
  static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

  static final String USAGE =
      "Usage: diarizer-cli [-o file] [-s speakers] [-f json|srt|vtt|text] [--llm-analysis]\n"
          + "                    [--server url] [--poll-interval seconds] [-q] <audio-file>\n"
          + "       diarizer-cli --health [--server url]";

  /**
   * Parse command-line arguments.
   *
   * @throws CliUsageException if an option is unknown, lacks its value or has a bad value, or if
   *     no audio file is given outside health-check mode
   */
  public static CliOptions parse(String... args) {
    Path audioFile = null;
    Path output = null;
    Integer speakers = null;
    ResponseFormat format = ResponseFormat.JSON;
    boolean llmAnalysis = false;
    String server = DEFAULT_SERVER;
    Duration pollInterval = DEFAULT_POLL_INTERVAL;
    boolean health = false;
    boolean quiet = false;

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
        case "-o", "--output" -> output = Path.of(valueOf(args, ++i, arg));
        case "-s", "--speakers" -> speakers = parseInt(valueOf(args, ++i, arg), arg);
        case "-f", "--format" -> format = parseFormat(valueOf(args, ++i, arg));
        case "--llm-analysis" -> llmAnalysis = true;
        case "--server" -> server = stripTrailingSlash(valueOf(args, ++i, arg));
        case "--poll-interval" -> {
          int seconds = parseInt(valueOf(args, ++i, arg), arg);
          if (seconds < 1) {
            throw new CliUsageException("--poll-interval must be at least 1 second");
          }
          pollInterval = Duration.ofSeconds(seconds);
        }
        case "--health" -> health = true;
        case "-q", "--quiet" -> quiet = true;
        default -> {
          if (arg.startsWith("-")) {
            throw new CliUsageException("Unknown option: " + arg);
          }
          if (audioFile != null) {
            throw new CliUsageException("Only one audio file can be submitted");
          }
          audioFile = Path.of(arg);
        }
      }
    }

    if (!health && audioFile == null) {
      throw new CliUsageException("Audio file is required (or use --health to check the server)");
    }
    return new CliOptions(
        audioFile, output, speakers, format, llmAnalysis, server, pollInterval, health, quiet);
  }

  /** The output file, or {@code <audio name>_transcript.<format>} in the working directory. */
  public Path outputOrDefault() {
    if (output != null) {
      return output;
    }
    String name = audioFile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    return Path.of(stem + "_transcript." + format.value());
  }

  private static String valueOf(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new CliUsageException("Missing value for " + option);
    }
    return args[index];
  }

  private static int parseInt(String value, String option) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new CliUsageException(option + " expects a number, got: " + value);
    }
  }

  private static ResponseFormat parseFormat(String value) {
    try {
      return ResponseFormat.fromValue(value);
    } catch (IllegalArgumentException e) {
      throw new CliUsageException(e.getMessage());
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
