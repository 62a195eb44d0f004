package com.evoila.argus.search;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Span text that a free-text search looks in. */
@Getter
@RequiredArgsConstructor
public enum SearchField {
  NAME("name"),
  INPUT("input"),
  OUTPUT("output");

  private final String column;

  /**
   * Parses a field name (case-insensitive).
   *
   * @throws IllegalArgumentException if the field is not searchable
   */
  public static SearchField fromString(String value) {
    return Arrays.stream(values())
        .filter(field -> field.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown search field: " + value));
  }
}
