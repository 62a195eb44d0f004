package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/** Shared checks for the renderer implementations. */
@Slf4j
final class FilterRenderers {

  private static final Pattern UUID_TEXT =
      Pattern.compile(
          "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private FilterRenderers() {
    // Utility class - prevent instantiation
  }

  /** Parses the filter operator, logging the dropped filter when it is unknown. */
  static Optional<OperatorKind> operatorOf(Filter filter) {
    Optional<OperatorKind> operator = filter.operatorKind();
    if (operator.isEmpty()) {
      log.warn(
          "Unknown operator '{}' on column '{}', filter skipped",
          filter.operator(),
          filter.column());
    }
    return operator;
  }

  /** Logs a value that cannot be read as the column type. */
  static void logIncompatibleValue(Filter filter, String expected) {
    log.warn(
        "Value {} on column '{}' is not a valid {}, filter skipped",
        filter.value(),
        filter.column(),
        expected);
  }

  /** Logs an operator that has no meaning for the column. */
  static void logUnsupportedOperator(Filter filter, OperatorKind operator) {
    log.warn(
        "Operator '{}' not supported on column '{}', filter skipped", operator, filter.column());
  }

  /** Whether the operator compares scalars: equality or ordering, no substring matching. */
  static boolean isComparison(OperatorKind operator) {
    return operator == OperatorKind.EQ || operator == OperatorKind.NE || operator.isOrdering();
  }

  /** Whether text is acceptable for a scalar parameter of the given type. */
  static boolean isValidText(ClickHouseType type, String text) {
    return type != ClickHouseType.UUID || UUID_TEXT.matcher(text.trim()).matches();
  }
}
