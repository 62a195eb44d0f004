package com.evoila.argus.common.query.model;

/** Shape of a filter value, resolved once when the filter is parsed. */
public enum ValueKind {
  STRING,
  NUMBER,
  BOOLEAN,
  STRING_ARRAY
}
