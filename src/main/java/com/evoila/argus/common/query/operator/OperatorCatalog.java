package com.evoila.argus.common.query.operator;

import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders operator/column/placeholder triples into SQL fragments.
 *
 * <p>Fails closed: an unknown operator symbol, or an operator that does not fit the column kind,
 * renders nothing. The caller drops the filter, so a malformed request can under-filter but never
 * produce broken SQL.
 */
@Slf4j
public final class OperatorCatalog {

  private OperatorCatalog() {
    // Utility class - prevent instantiation
  }

  /**
   * Renders a fragment for a scalar column.
   *
   * @param operatorSymbol Operator symbol as sent by the client
   * @param columnExpr Column or expression on the left-hand side (always code-supplied)
   * @param placeholder Parameter placeholder on the right-hand side
   * @return SQL fragment, or empty when the operator is unknown or array-only
   */
  public static Optional<String> render(
      String operatorSymbol, String columnExpr, String placeholder) {
    Optional<OperatorKind> operator = OperatorKind.fromSymbol(operatorSymbol);
    if (operator.isEmpty()) {
      log.warn("Unknown operator '{}' on '{}', condition skipped", operatorSymbol, columnExpr);
      return Optional.empty();
    }
    return render(operator.get(), columnExpr, placeholder);
  }

  /** Scalar rendering for an already parsed operator. */
  public static Optional<String> render(
      OperatorKind operator, String columnExpr, String placeholder) {
    if (operator.isArrayOperator()) {
      log.debug("Array operator '{}' not valid for scalar column '{}'", operator, columnExpr);
      return Optional.empty();
    }
    if (operator == OperatorKind.CONTAINS || operator == OperatorKind.NOT_CONTAINS) {
      return Optional.of(
          columnExpr + " " + operator.getSqlToken() + " concat('%', " + placeholder + ", '%')");
    }
    return Optional.of(columnExpr + " " + operator.getSqlToken() + " " + placeholder);
  }

  /**
   * Renders a membership fragment for an array column.
   *
   * <p>{@code eq}/{@code has} test membership, {@code ne}/{@code not_has} its negation. Ordering
   * and substring operators have no array meaning and render nothing.
   */
  public static Optional<String> renderArrayMembership(
      OperatorKind operator, String arrayColumn, String placeholder) {
    return switch (operator) {
      case EQ, HAS -> Optional.of("has(" + arrayColumn + ", " + placeholder + ")");
      case NE, NOT_HAS -> Optional.of("NOT has(" + arrayColumn + ", " + placeholder + ")");
      default -> {
        log.debug("Operator '{}' not valid for array column '{}'", operator, arrayColumn);
        yield Optional.empty();
      }
    };
  }
}
