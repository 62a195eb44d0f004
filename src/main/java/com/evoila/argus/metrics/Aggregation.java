package com.evoila.argus.metrics;

import java.util.Arrays;
import java.util.Locale;

/** Aggregate function applied to each time bucket. */
public enum Aggregation {
  COUNT("count()"),
  SUM("sum(%s)"),
  AVG("avg(%s)"),
  MIN("min(%s)"),
  MAX("max(%s)"),
  P50("quantile(0.5)(%s)"),
  P90("quantile(0.9)(%s)"),
  P95("quantile(0.95)(%s)"),
  P99("quantile(0.99)(%s)");

  private final String template;

  Aggregation(String template) {
    this.template = template;
  }

  /**
   * Applies the function to a code-supplied value expression. Empty buckets yield 0 rather than
   * NaN so filled and unfilled rows read the same.
   */
  public String toSql(String valueExpression) {
    String aggregate = String.format(Locale.ROOT, template, valueExpression);
    return "ifNotFinite(toFloat64(" + aggregate + "), 0)";
  }

  /**
   * Parses an aggregation name (case-insensitive).
   *
   * @param value Requested name, or null for {@code fallback}
   * @param fallback Aggregation used when none is requested
   * @throws IllegalArgumentException if the name is not recognized
   */
  public static Aggregation fromString(String value, Aggregation fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Arrays.stream(values())
        .filter(aggregation -> aggregation.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown aggregation: " + value));
  }
}
