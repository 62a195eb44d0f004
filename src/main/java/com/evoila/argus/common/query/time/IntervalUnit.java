package com.evoila.argus.common.query.time;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;

/** Units available for time bucketing. */
@Getter
public enum IntervalUnit {
  MINUTE("MINUTE", Duration.ofMinutes(1)),
  HOUR("HOUR", Duration.ofHours(1)),
  DAY("DAY", Duration.ofDays(1));

  /** -- GETTER -- SQL interval keyword */
  private final String keyword;

  /** -- GETTER -- Length of one unit */
  private final Duration length;

  IntervalUnit(String keyword, Duration length) {
    this.keyword = keyword;
    this.length = length;
  }

  public static Optional<IntervalUnit> fromString(String unit) {
    if (unit == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(u -> u.keyword.equalsIgnoreCase(unit.trim()))
        .findFirst();
  }
}
