package de.uni_passau.fluxbench.utils;

import java.time.Duration;
import java.time.Instant;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

/** Time utility. */
public class TimeUtils {

  /** RFC-3339 in UTC, truncated to seconds. */
  private static final DateTimeFormatter RFC3339_SECONDS =
      DateTimeFormat.forPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZoneUTC();

  private static final long NANOS_PER_MICRO = 1000L;
  private static final long NANOS_PER_MILLI = 1000L * NANOS_PER_MICRO;
  private static final long NANOS_PER_SECOND = 1000L * NANOS_PER_MILLI;
  private static final long NANOS_PER_MINUTE = 60L * NANOS_PER_SECOND;
  private static final long NANOS_PER_HOUR = 60L * NANOS_PER_MINUTE;

  private TimeUtils() {}

  /**
   * Converts a datetime string to an instant. Strings without an offset are read as UTC.
   *
   * @param dateStr Datetime string, e.g., 2016-01-01T00:00:00Z.
   * @return The parsed instant.
   */
  public static Instant convertDateStrToInstant(String dateStr) {
    DateTime dateTime = new DateTime(dateStr, DateTimeZone.UTC);
    return Instant.ofEpochMilli(dateTime.getMillis());
  }

  /**
   * Formats an instant as <code>YYYY-MM-DDTHH:MM:SSZ</code>. Sub-second parts are dropped.
   *
   * @param instant Instant to format.
   * @return RFC-3339 representation with second precision.
   */
  public static String formatRfc3339(Instant instant) {
    return RFC3339_SECONDS.print(instant.toEpochMilli());
  }

  /**
   * Renders a duration the way the harness labels print it, e.g., <code>1s</code>,
   * <code>8h0m0s</code>, <code>1.5ms</code>. Durations under one second use the largest of
   * ns, µs and ms that keeps an integer part.
   *
   * @param duration Duration to render.
   * @return Compact textual form.
   */
  public static String formatDuration(Duration duration) {
    long nanos = duration.toNanos();
    if (nanos == 0) {
      return "0s";
    }
    boolean negative = nanos < 0;
    long u = Math.abs(nanos);

    StringBuilder sb = new StringBuilder();
    if (negative) {
      sb.append('-');
    }
    if (u < NANOS_PER_SECOND) {
      if (u < NANOS_PER_MICRO) {
        sb.append(u).append("ns");
      } else if (u < NANOS_PER_MILLI) {
        sb.append(fraction(u, 3)).append("µs");
      } else {
        sb.append(fraction(u, 6)).append("ms");
      }
      return sb.toString();
    }

    long hours = u / NANOS_PER_HOUR;
    long minutes = (u % NANOS_PER_HOUR) / NANOS_PER_MINUTE;
    long secondNanos = u % NANOS_PER_MINUTE;
    if (hours > 0) {
      sb.append(hours).append('h');
    }
    if (hours > 0 || minutes > 0) {
      sb.append(minutes).append('m');
    }
    sb.append(fraction(secondNanos, 9)).append('s');
    return sb.toString();
  }

  /**
   * Prints <code>value / 10^precision</code> with trailing zeros of the fraction removed.
   */
  private static String fraction(long value, int precision) {
    long unit = 1;
    for (int i = 0; i < precision; i++) {
      unit *= 10;
    }
    long whole = value / unit;
    long frac = value % unit;
    if (frac == 0) {
      return Long.toString(whole);
    }
    StringBuilder digits = new StringBuilder(Long.toString(frac));
    while (digits.length() < precision) {
      digits.insert(0, '0');
    }
    int end = digits.length();
    while (digits.charAt(end - 1) == '0') {
      end--;
    }
    return whole + "." + digits.substring(0, end);
  }
}
