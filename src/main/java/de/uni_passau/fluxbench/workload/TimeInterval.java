package de.uni_passau.fluxbench.workload;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import de.uni_passau.fluxbench.utils.LaggedFibonacciRandom;
import de.uni_passau.fluxbench.utils.TimeUtils;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Half-open time interval <code>[start, end)</code>. Used both as the global simulation interval
 * of a generator and as the random windows sampled from it.
 */
public class TimeInterval {

  private static final String WINDOW_TOO_LARGE =
      "random window larger than TimeInterval: window %s, interval %s";

  /** Inclusive left boundary. */
  private final Instant start;

  /** Exclusive right boundary. */
  private final Instant end;

  /**
   * Creates an interval.
   *
   * @param start Left boundary.
   * @param end Right boundary, must not lie before <code>start</code>.
   */
  public TimeInterval(Instant start, Instant end) {
    checkNotNull(start);
    checkNotNull(end);
    checkArgument(!end.isBefore(start), "interval end %s is before start %s", end, start);
    this.start = start;
    this.end = end;
  }

  public Instant getStart() {
    return start;
  }

  public Instant getEnd() {
    return end;
  }

  /**
   * Returns the length of the interval.
   *
   * @return <code>end - start</code>.
   */
  public Duration getDuration() {
    return Duration.between(start, end);
  }

  /**
   * Returns the left boundary as an RFC-3339 string with second precision.
   *
   * @return Formatted start.
   */
  public String startString() {
    return TimeUtils.formatRfc3339(start);
  }

  /**
   * Returns the right boundary as an RFC-3339 string with second precision.
   *
   * @return Formatted end.
   */
  public String endString() {
    return TimeUtils.formatRfc3339(end);
  }

  /**
   * Seconds elapsed since midnight (UTC) at the start of the interval.
   *
   * @return Second of day of {@link #getStart()}.
   */
  public int startSecondOfDay() {
    ZonedDateTime utc = start.atZone(ZoneOffset.UTC);
    return utc.getHour() * 3600 + utc.getMinute() * 60 + utc.getSecond();
  }

  /**
   * Picks a sub-interval of length <code>window</code> at random. The offset from {@link
   * #getStart()} is drawn in nanoseconds from <code>[0, duration - window)</code>; a window as
   * long as the interval starts at {@link #getStart()} without a draw.
   *
   * @param window Length of the window.
   * @param random Shared random source.
   * @return Window lying completely within this interval.
   * @throws WorkloadException if the window does not fit into this interval.
   */
  public TimeInterval mustRandWindow(Duration window, LaggedFibonacciRandom random)
      throws WorkloadException {
    checkNotNull(window);
    checkNotNull(random);
    long span = getDuration().toNanos();
    long length = window.toNanos();
    if (length < 0 || length > span) {
      throw new WorkloadException(
          String.format(
              WINDOW_TOO_LARGE,
              TimeUtils.formatDuration(window),
              TimeUtils.formatDuration(getDuration())));
    }
    long offset = length == span ? 0 : random.nextLong(span - length);
    Instant windowStart = start.plusNanos(offset);
    return new TimeInterval(windowStart, windowStart.plusNanos(length));
  }

  @Override
  public String toString() {
    return "[" + startString() + ", " + endString() + ")";
  }
}
