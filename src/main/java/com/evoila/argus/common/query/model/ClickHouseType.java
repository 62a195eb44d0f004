package com.evoila.argus.common.query.model;

import lombok.Getter;

/**
 * Wire types used in ClickHouse query parameter placeholders ({@code {name:Type}}).
 *
 * <p>Every bound parameter carries one of these so the server parses the value with the intended
 * type instead of inferring it from the text.
 */
@Getter
public enum ClickHouseType {
  STRING("String", false),
  UUID("UUID", false),
  INT64("Int64", false),
  UINT32("UInt32", false),
  FLOAT64("Float64", false),
  DATETIME64("DateTime64(9)", false),
  ARRAY_STRING("Array(String)", true),
  ARRAY_UUID("Array(UUID)", true);

  /** -- GETTER -- The type name exactly as it appears in the placeholder */
  private final String typeName;

  /** -- GETTER -- Whether values of this type are serialized as array literals */
  private final boolean array;

  ClickHouseType(String typeName, boolean array) {
    this.typeName = typeName;
    this.array = array;
  }

  /**
   * Builds the placeholder text for a parameter of this type.
   *
   * @param name The parameter name
   * @return Placeholder such as {@code {status_0:String}}
   */
  public String placeholder(String name) {
    return "{" + name + ":" + typeName + "}";
  }

  @Override
  public String toString() {
    return typeName;
  }
}
