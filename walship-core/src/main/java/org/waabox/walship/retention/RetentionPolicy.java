package org.waabox.walship.retention;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Bounds the frame history each database retains.
 *
 * <p>A frame may be pruned once it is older than {@link #duration()}, or
 * once it falls outside the last {@link #maxFrames()} frames when a frame
 * cap is set. Frames still needed by a connected replica, or by one that
 * disconnected less than {@link #duration()} ago, are always kept.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetentionPolicy {

  /** The default retention duration. */
  private static final Duration DEFAULT_DURATION = Duration.ofHours(24);

  /** The default interval between sweeps. */
  private static final Duration DEFAULT_MONITOR_INTERVAL =
      Duration.ofMinutes(1);

  /** How long frames are retained, never null. */
  private final Duration duration;

  /** The maximum number of frames retained, or 0 for no cap. */
  private final int maxFrames;

  /** The interval between sweeps, never null. */
  private final Duration monitorInterval;

  private RetentionPolicy(final Duration theDuration, final int theMaxFrames,
      final Duration theMonitorInterval) {
    duration = theDuration;
    maxFrames = theMaxFrames;
    monitorInterval = theMonitorInterval;
  }

  /**
   * Creates a policy bounded by age only.
   *
   * @param duration        how long frames are retained, must be positive
   * @param monitorInterval the interval between sweeps, must be positive
   *
   * @return the policy, never null
   */
  public static RetentionPolicy create(final Duration duration,
      final Duration monitorInterval) {
    return create(duration, 0, monitorInterval);
  }

  /**
   * Creates a policy bounded by age and frame count.
   *
   * @param duration        how long frames are retained, must be positive
   * @param maxFrames       the frame cap, 0 for none, must not be negative
   * @param monitorInterval the interval between sweeps, must be positive
   *
   * @return the policy, never null
   */
  public static RetentionPolicy create(final Duration duration,
      final int maxFrames, final Duration monitorInterval) {
    Objects.requireNonNull(duration, "duration must not be null");
    Objects.requireNonNull(monitorInterval,
        "monitorInterval must not be null");
    if (duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException(
          "duration must be positive, got: " + duration);
    }
    if (monitorInterval.isZero() || monitorInterval.isNegative()) {
      throw new IllegalArgumentException(
          "monitorInterval must be positive, got: " + monitorInterval);
    }
    if (maxFrames < 0) {
      throw new IllegalArgumentException(
          "maxFrames must not be negative, got: " + maxFrames);
    }
    return new RetentionPolicy(duration, maxFrames, monitorInterval);
  }

  /**
   * Creates the default policy: 24 hours, no frame cap, one sweep per
   * minute.
   *
   * @return the policy, never null
   */
  public static RetentionPolicy defaultPolicy() {
    return new RetentionPolicy(DEFAULT_DURATION, 0,
        DEFAULT_MONITOR_INTERVAL);
  }

  /**
   * Returns how long frames are retained.
   *
   * @return the duration, never null
   */
  public Duration duration() {
    return duration;
  }

  /**
   * Returns the frame cap.
   *
   * @return the cap, or empty when only age bounds the history
   */
  public OptionalInt maxFrames() {
    return maxFrames == 0 ? OptionalInt.empty() : OptionalInt.of(maxFrames);
  }

  /**
   * Returns the interval between sweeps.
   *
   * @return the interval, never null
   */
  public Duration monitorInterval() {
    return monitorInterval;
  }

  @Override
  public String toString() {
    return "RetentionPolicy[duration=" + duration + ", maxFrames="
        + (maxFrames == 0 ? "unbounded" : String.valueOf(maxFrames))
        + ", monitorInterval=" + monitorInterval + "]";
  }
}
