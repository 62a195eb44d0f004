package com.evoila.argus.common.query.model;

import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.Optional;

/**
 * A single declarative predicate supplied by a caller.
 *
 * <p>The operator is kept as the symbol the client sent; it is resolved against {@link
 * OperatorKind} only at render time so an unknown symbol drops the filter instead of failing the
 * request.
 */
public record Filter(String column, String operator, FilterValue value) {

  public static Filter of(String column, OperatorKind operator, FilterValue value) {
    return new Filter(column, operator.getSymbol(), value);
  }

  public static Filter of(String column, String operator, String value) {
    return new Filter(column, operator, FilterValue.ofString(value));
  }

  public Optional<OperatorKind> operatorKind() {
    return OperatorKind.fromSymbol(operator);
  }
}
