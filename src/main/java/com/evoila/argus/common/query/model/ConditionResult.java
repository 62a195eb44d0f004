package com.evoila.argus.common.query.model;

/**
 * A rendered SQL predicate together with the parameters its placeholders reference.
 *
 * <p>Also used for call-site conditions that are not user filters, e.g. {@code trace_type =
 * {trace_type:String}}.
 */
public record ConditionResult(String condition, QueryParams params) {

  public static ConditionResult of(String condition) {
    return new ConditionResult(condition, QueryParams.empty());
  }

  public static ConditionResult of(String condition, QueryParams params) {
    return new ConditionResult(condition, params);
  }

  /** {@code column = {name:Type}} for call-site conditions such as project scoping. */
  public static ConditionResult equalTo(
      String column, String name, Object value, ClickHouseType type) {
    QueryParams params = new QueryParams();
    String placeholder = params.put(name, value, type);
    return new ConditionResult(column + " = " + placeholder, params);
  }

  /** {@code column IN ({name:Array(T)})} for id pre-selection. */
  public static ConditionResult in(
      String column, String name, Object values, ClickHouseType arrayType) {
    QueryParams params = new QueryParams();
    String placeholder = params.put(name, values, arrayType);
    return new ConditionResult(column + " IN (" + placeholder + ")", params);
  }
}
