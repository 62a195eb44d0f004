package com.evoila.argus.common.query.time;

import java.time.Duration;

/** Bucket width for time-series aggregation, e.g. 5 MINUTE. */
public record BucketInterval(int value, IntervalUnit unit) {

  private static final Duration ONE_HOUR = Duration.ofHours(1);
  private static final Duration ONE_DAY = Duration.ofDays(1);

  public BucketInterval {
    if (value <= 0) {
      throw new IllegalArgumentException("Bucket interval must be positive: " + value);
    }
    if (unit == null) {
      throw new IllegalArgumentException("Bucket interval unit cannot be null");
    }
  }

  public static BucketInterval of(int value, IntervalUnit unit) {
    return new BucketInterval(value, unit);
  }

  /**
   * Picks a bucket width for a window length: up to an hour uses 5 minutes, up to a day uses 1
   * hour, anything longer uses 1 day.
   */
  public static BucketInterval auto(Duration window) {
    if (window.compareTo(ONE_HOUR) <= 0) {
      return new BucketInterval(5, IntervalUnit.MINUTE);
    }
    if (window.compareTo(ONE_DAY) <= 0) {
      return new BucketInterval(1, IntervalUnit.HOUR);
    }
    return new BucketInterval(1, IntervalUnit.DAY);
  }

  /** SQL interval literal; both parts are code-controlled so no parameter is needed. */
  public String toSql() {
    return "INTERVAL " + value + " " + unit.getKeyword();
  }
}
