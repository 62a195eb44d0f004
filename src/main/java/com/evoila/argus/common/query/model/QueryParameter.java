package com.evoila.argus.common.query.model;

import java.util.Objects;

/** A driver-ready parameter value together with its explicit ClickHouse wire type. */
public record QueryParameter(Object value, ClickHouseType type) {

  public QueryParameter {
    Objects.requireNonNull(value, "Parameter value cannot be null");
    Objects.requireNonNull(type, "Parameter type cannot be null");
  }
}
