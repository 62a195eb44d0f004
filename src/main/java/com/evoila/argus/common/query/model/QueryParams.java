package com.evoila.argus.common.query.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping from unique parameter names to typed values.
 *
 * <p>Names are assigned by the code that writes the matching placeholder, so a second binding
 * under an existing name is always a builder bug. {@link #put} and {@link #putAll} reject it
 * instead of silently overwriting the first value.
 */
public final class QueryParams {

  private final Map<String, QueryParameter> parameters = new LinkedHashMap<>();

  public static QueryParams empty() {
    return new QueryParams();
  }

  public static QueryParams of(String name, Object value, ClickHouseType type) {
    QueryParams params = new QueryParams();
    params.put(name, value, type);
    return params;
  }

  /**
   * Binds a value and returns the placeholder that references it.
   *
   * @param name Unique parameter name
   * @param value The value to bind
   * @param type The ClickHouse wire type
   * @return Placeholder text for the SQL fragment
   * @throws IllegalStateException if the name is already bound
   */
  public String put(String name, Object value, ClickHouseType type) {
    if (parameters.containsKey(name)) {
      throw new IllegalStateException("Duplicate query parameter: " + name);
    }
    parameters.put(name, new QueryParameter(value, type));
    return type.placeholder(name);
  }

  /**
   * Merges all bindings of another parameter set into this one.
   *
   * @throws IllegalStateException if any name is bound in both sets
   */
  public QueryParams putAll(QueryParams other) {
    other.parameters.forEach((name, parameter) -> put(name, parameter.value(), parameter.type()));
    return this;
  }

  public QueryParameter get(String name) {
    return parameters.get(name);
  }

  public boolean contains(String name) {
    return parameters.containsKey(name);
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(parameters.keySet());
  }

  public Map<String, QueryParameter> asMap() {
    return Collections.unmodifiableMap(parameters);
  }

  /** Plain name to value view, the shape callers hand to a client or serialize in responses. */
  public Map<String, Object> values() {
    Map<String, Object> values = new LinkedHashMap<>();
    parameters.forEach((name, parameter) -> values.put(name, parameter.value()));
    return values;
  }

  public boolean isEmpty() {
    return parameters.isEmpty();
  }

  public int size() {
    return parameters.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryParams other)) {
      return false;
    }
    return parameters.equals(other.parameters);
  }

  @Override
  public int hashCode() {
    return parameters.hashCode();
  }

  @Override
  public String toString() {
    return parameters.toString();
  }
}
