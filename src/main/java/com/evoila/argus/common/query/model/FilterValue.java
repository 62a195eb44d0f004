package com.evoila.argus.common.query.model;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tagged filter value: a string, a number, a boolean or a list of strings.
 *
 * <p>The {@link ValueKind} is fixed at construction. Renderers ask for the representation they
 * need ({@link #asText()}, {@link #asDouble()}, {@link #asLong()}, {@link #asStrings()}) and get an
 * empty result when the value cannot be read that way, which turns the filter into a no-op.
 */
public final class FilterValue {

  private final ValueKind kind;
  private final Object raw;

  private FilterValue(ValueKind kind, Object raw) {
    this.kind = kind;
    this.raw = raw;
  }

  public static FilterValue ofString(String value) {
    return new FilterValue(ValueKind.STRING, Objects.requireNonNull(value));
  }

  public static FilterValue ofNumber(Number value) {
    return new FilterValue(ValueKind.NUMBER, new BigDecimal(value.toString()));
  }

  public static FilterValue ofBoolean(boolean value) {
    return new FilterValue(ValueKind.BOOLEAN, value);
  }

  public static FilterValue ofStrings(Collection<String> values) {
    return new FilterValue(ValueKind.STRING_ARRAY, List.copyOf(values));
  }

  /**
   * Converts a decoded JSON value into a filter value.
   *
   * @param json A String, Number, Boolean or Collection as produced by a JSON mapper
   * @return The filter value, or empty for null, objects and nested structures
   */
  public static Optional<FilterValue> fromJson(Object json) {
    if (json instanceof String s) {
      return Optional.of(ofString(s));
    }
    if (json instanceof Number n) {
      return Optional.of(ofNumber(n));
    }
    if (json instanceof Boolean b) {
      return Optional.of(ofBoolean(b));
    }
    if (json instanceof Collection<?> items) {
      if (items.stream().anyMatch(item -> item instanceof Collection || item instanceof Map)) {
        return Optional.empty();
      }
      return Optional.of(
          ofStrings(items.stream().filter(Objects::nonNull).map(FilterValue::scalarText).toList()));
    }
    return Optional.empty();
  }

  public ValueKind kind() {
    return kind;
  }

  public boolean isArray() {
    return kind == ValueKind.STRING_ARRAY;
  }

  /** Text form of a scalar value; empty for arrays. */
  public Optional<String> asText() {
    if (isArray()) {
      return Optional.empty();
    }
    return Optional.of(scalarText(raw));
  }

  /** Numeric form; strings are parsed, booleans and arrays are not numbers. */
  public Optional<Double> asDouble() {
    return asDecimal().map(BigDecimal::doubleValue).filter(d -> !d.isNaN() && !d.isInfinite());
  }

  /** Integral form; values with a fractional part are rejected rather than truncated. */
  public Optional<Long> asLong() {
    return asDecimal()
        .flatMap(
            decimal -> {
              try {
                return Optional.of(decimal.longValueExact());
              } catch (ArithmeticException e) {
                return Optional.empty();
              }
            });
  }

  /** List form; a scalar becomes a single-element list. */
  @SuppressWarnings("unchecked")
  public List<String> asStrings() {
    if (isArray()) {
      return (List<String>) raw;
    }
    return List.of(scalarText(raw));
  }

  private Optional<BigDecimal> asDecimal() {
    if (kind == ValueKind.NUMBER) {
      return Optional.of((BigDecimal) raw);
    }
    if (kind == ValueKind.STRING) {
      try {
        return Optional.of(new BigDecimal(((String) raw).trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  private static String scalarText(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal.stripTrailingZeros().toPlainString();
    }
    if (value instanceof Double || value instanceof Float) {
      return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
    }
    return String.valueOf(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FilterValue other)) {
      return false;
    }
    return kind == other.kind && raw.equals(other.raw);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, raw);
  }

  @Override
  public String toString() {
    return kind + ":" + (isArray() ? raw : scalarText(raw));
  }
}
