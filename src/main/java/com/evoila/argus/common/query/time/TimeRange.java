package com.evoila.argus.common.query.time;

import java.time.Duration;
import java.util.Optional;

/**
 * Requested time window: an explicit start (and optional end), the last N hours, or unbounded.
 *
 * <p>At most one form is populated. When both an explicit start and {@code pastHours} are
 * supplied the explicit range wins and {@code pastHours} is discarded.
 */
public record TimeRange(Integer pastHours, String startDate, String endDate) {

  private static final TimeRange UNBOUNDED = new TimeRange(null, null, null);

  public TimeRange {
    if (isBlank(startDate)) {
      startDate = null;
      endDate = null;
    } else {
      pastHours = null;
      endDate = isBlank(endDate) ? null : endDate;
    }
    if (pastHours != null && pastHours <= 0) {
      pastHours = null;
    }
  }

  public static TimeRange unbounded() {
    return UNBOUNDED;
  }

  public static TimeRange pastHours(int hours) {
    return new TimeRange(hours, null, null);
  }

  public static TimeRange between(String startDate, String endDate) {
    return new TimeRange(null, startDate, endDate);
  }

  /**
   * Builds a range from raw request parameters.
   *
   * <p>{@code pastHours} is read as a number and rounded up to whole hours, so a fraction still
   * bounds the window; anything non-numeric (the UI sends {@code "all"}) means no relative bound.
   *
   * @throws IllegalArgumentException if {@code startDate} or {@code endDate} is not a date
   */
  public static TimeRange fromRequest(String pastHours, String startDate, String endDate) {
    requireDate("startDate", startDate);
    requireDate("endDate", endDate);
    return new TimeRange(parseHours(pastHours), startDate, endDate);
  }

  public boolean isExplicit() {
    return startDate != null;
  }

  public boolean isRelative() {
    return pastHours != null;
  }

  public boolean isBounded() {
    return isExplicit() || isRelative();
  }

  /** Length of the relative window; empty for explicit and unbounded ranges. */
  public Optional<Duration> relativeDuration() {
    return isRelative() ? Optional.of(Duration.ofHours(pastHours)) : Optional.empty();
  }

  private static Integer parseHours(String raw) {
    if (isBlank(raw)) {
      return null;
    }
    try {
      double hours = Double.parseDouble(raw.trim());
      if (Double.isNaN(hours) || Double.isInfinite(hours)) {
        return null;
      }
      return (int) Math.ceil(hours);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static void requireDate(String name, String value) {
    if (!isBlank(value) && TimeRangeResolver.parseInstant(value).isEmpty()) {
      throw new IllegalArgumentException(name + " is not a valid date: " + value);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
