package com.evoila.argus.metrics;

/**
 * A permitted series split.
 *
 * @param selectExpression Selected term, aliased when it is not a plain column
 * @param key Name the rows are grouped and ordered by
 */
public record GroupBy(String selectExpression, String key) {

  public static GroupBy column(String column) {
    return new GroupBy(column, column);
  }

  public static GroupBy expression(String expression, String alias) {
    return new GroupBy(expression + " AS " + alias, alias);
  }
}
