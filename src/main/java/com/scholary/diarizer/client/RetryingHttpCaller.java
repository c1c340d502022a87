package com.scholary.diarizer.client;

import java.io.IOException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * Retry loop with exponential backoff for collaborator HTTP calls.
 *
 * <p>Only {@link IOException} is retried: connection failures, timeouts and non-2xx responses,
 * which the callers report as IOException. Backoff is {@code 2^attempt} seconds plus up to one
 * second of jitter.
 */
public final class RetryingHttpCaller {

  /** A single HTTP attempt. */
  @FunctionalInterface
  public interface Attempt<T> {
    T call() throws IOException, InterruptedException;
  }

  private final Logger logger;
  private final String operation;
  private final int maxAttempts;
  private final long baseBackoffMs;

  public RetryingHttpCaller(Logger logger, String operation, int maxAttempts) {
    this(logger, operation, maxAttempts, 1000);
  }

  public RetryingHttpCaller(Logger logger, String operation, int maxAttempts, long baseBackoffMs) {
    this.logger = logger;
    this.operation = operation;
    this.maxAttempts = Math.max(1, maxAttempts);
    this.baseBackoffMs = baseBackoffMs;
  }

  /**
   * Run the attempt until it succeeds or the attempts are used up.
   *
   * @param attempt the call to make
   * @param failure builds the exception thrown when every attempt failed or the thread was
   *     interrupted
   */
  public <T, E extends RuntimeException> T call(
      Attempt<T> attempt, Function<FailureDetail, E> failure) {
    int attemptNumber = 0;
    Exception lastException = null;

    while (attemptNumber < maxAttempts) {
      try {
        return attempt.call();
      } catch (IOException e) {
        lastException = e;
        attemptNumber++;
        if (attemptNumber < maxAttempts) {
          long backoffMs =
              (long)
                  (Math.pow(2, attemptNumber) * baseBackoffMs
                      + ThreadLocalRandom.current().nextDouble() * baseBackoffMs);
          logger.warn(
              "{} attempt {} failed, retrying in {}ms: {}",
              operation,
              attemptNumber,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw failure.apply(new FailureDetail(operation + " interrupted", ie));
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw failure.apply(new FailureDetail(operation + " interrupted", e));
      }
    }

    throw failure.apply(
        new FailureDetail(
            String.format(
                "%s failed after %d attempts: %s",
                operation, maxAttempts, lastException.getMessage()),
            lastException));
  }

  /** Message and cause handed to the failure factory. */
  public record FailureDetail(String message, Exception cause) {}
}
