package com.evoila.argus.clickhouse;

import com.evoila.argus.common.query.model.QueryParameter;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes bound parameters into the text form ClickHouse expects for {@code param_<name>}.
 *
 * <p>Scalars use the escaped format, where only backslash and control characters need escaping.
 * Arrays are literals like {@code ['a','b']} with quotes and backslashes escaped inside elements.
 */
public final class ClickHouseParameterSerializer {

  private ClickHouseParameterSerializer() {
    // Utility class - prevent instantiation
  }

  public static String serialize(QueryParameter parameter) {
    Object value = parameter.value();
    if (parameter.type().isArray()) {
      Collection<?> items = value instanceof Collection<?> c ? c : List.of(value);
      return items.stream()
          .map(item -> "'" + escapeQuoted(scalarText(item)) + "'")
          .collect(Collectors.joining(",", "[", "]"));
    }
    return escape(scalarText(value));
  }

  private static String scalarText(Object value) {
    if (value instanceof Double d) {
      return BigDecimal.valueOf(d).toPlainString();
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    return String.valueOf(value);
  }

  private static String escape(String text) {
    StringBuilder escaped = new StringBuilder(text.length());
    for (char c : text.toCharArray()) {
      switch (c) {
        case '\\' -> escaped.append("\\\\");
        case '\t' -> escaped.append("\\t");
        case '\n' -> escaped.append("\\n");
        case '\r' -> escaped.append("\\r");
        default -> escaped.append(c);
      }
    }
    return escaped.toString();
  }

  private static String escapeQuoted(String text) {
    return escape(text).replace("'", "\\'");
  }
}
