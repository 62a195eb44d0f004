package com.evoila.argus.common.query.model;

/**
 * The FROM target: a plain table, a join, or a table-valued function with its own bound
 * parameters.
 */
public record TableSource(String expression, QueryParams params) {

  public static TableSource table(String name) {
    return new TableSource(name, QueryParams.empty());
  }

  public static TableSource function(String expression, QueryParams params) {
    return new TableSource(expression, params);
  }
}
