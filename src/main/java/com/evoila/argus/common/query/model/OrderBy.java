package com.evoila.argus.common.query.model;

/** One ORDER BY term. Expressions come from table definitions, never from request input. */
public record OrderBy(String expression, Direction direction) {

  public enum Direction {
    ASC,
    DESC
  }

  public static OrderBy asc(String expression) {
    return new OrderBy(expression, Direction.ASC);
  }

  public static OrderBy desc(String expression) {
    return new OrderBy(expression, Direction.DESC);
  }

  public String toSql() {
    return expression + " " + (direction != null ? direction : Direction.DESC);
  }
}
