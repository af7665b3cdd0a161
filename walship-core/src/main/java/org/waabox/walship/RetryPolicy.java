package org.waabox.walship;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines the backoff between attempts of the store retry loops (lease
 * backend reconnection, replication stream reconnection).
 *
 * <p>Retries are unbounded; the delay doubles on every consecutive failure
 * starting at the initial backoff and is capped at the maximum backoff.
 * The default policy starts at 1 second and is capped at 30 seconds.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default initial backoff. */
  private static final Duration DEFAULT_INITIAL_BACKOFF =
      Duration.ofSeconds(1);

  /** The default maximum backoff. */
  private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

  /** The delay after the first failure. */
  private final Duration initialBackoff;

  /** The upper bound of the delay. */
  private final Duration maxBackoff;

  /**
   * Creates a new retry policy.
   *
   * @param initialBackoff the delay after the first failure, never null
   * @param maxBackoff     the upper bound of the delay, never null
   */
  private RetryPolicy(final Duration initialBackoff,
      final Duration maxBackoff) {
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param initialBackoff the delay after the first failure, must be
   *                       positive
   * @param maxBackoff     the upper bound of the delay, must not be lower
   *                       than initialBackoff
   * @return a new retry policy, never null
   *
   * @throws NullPointerException     if any argument is null
   * @throws IllegalArgumentException if initialBackoff is not positive or
   *                                  maxBackoff is lower than it
   */
  public static RetryPolicy of(final Duration initialBackoff,
      final Duration maxBackoff) {
    Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    if (initialBackoff.isZero() || initialBackoff.isNegative()) {
      throw new IllegalArgumentException(
          "initialBackoff must be positive, got: " + initialBackoff);
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff " + maxBackoff
          + " must not be lower than initialBackoff " + initialBackoff);
    }
    return new RetryPolicy(initialBackoff, maxBackoff);
  }

  /**
   * Creates a retry policy with sensible defaults: 1 second doubling up to
   * 30 seconds.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF);
  }

  /**
   * Returns the delay to wait before the given attempt.
   *
   * @param failures the number of consecutive failures so far, a value
   *                 lower than 1 is treated as 1
   * @return the delay, never null, never above {@link #maxBackoff()}
   */
  public Duration backoff(final int failures) {
    final int exponent = Math.min(Math.max(failures, 1) - 1, 30);
    final long millis = initialBackoff.toMillis() << exponent;
    if (millis <= 0 || millis >= maxBackoff.toMillis()) {
      return maxBackoff;
    }
    return Duration.ofMillis(millis);
  }

  /**
   * Returns the delay after the first failure.
   *
   * @return the initial backoff, never null
   */
  public Duration initialBackoff() {
    return initialBackoff;
  }

  /**
   * Returns the upper bound of the delay.
   *
   * @return the maximum backoff, never null
   */
  public Duration maxBackoff() {
    return maxBackoff;
  }
}
