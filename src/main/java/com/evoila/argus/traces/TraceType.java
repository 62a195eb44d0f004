package com.evoila.argus.traces;

import java.util.Arrays;

/** Origin of a trace; list views show one type at a time. */
public enum TraceType {
  DEFAULT,
  EVALUATION,
  EVENT,
  PLAYGROUND;

  /**
   * Parses a trace type (case-insensitive); null or blank means {@link #DEFAULT}.
   *
   * @throws IllegalArgumentException if the type is not recognized
   */
  public static TraceType fromString(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT;
    }
    return Arrays.stream(values())
        .filter(type -> type.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown trace type: " + value));
  }
}
