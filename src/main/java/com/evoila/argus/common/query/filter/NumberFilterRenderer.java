package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.operator.OperatorCatalog;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.Optional;

/**
 * Generic renderer for numeric columns and numeric expressions such as {@code (end_time -
 * start_time)}.
 *
 * <p>The value is parsed for the target type before binding: integral types reject fractions,
 * {@code UInt32} rejects negatives and out-of-range values. A value that does not parse makes the
 * filter a no-op.
 */
public final class NumberFilterRenderer implements ColumnFilterRenderer {

  private static final long UINT32_MAX = 0xFFFFFFFFL;

  private final String expression;
  private final ClickHouseType type;

  public NumberFilterRenderer(String expression, ClickHouseType type) {
    if (type != ClickHouseType.INT64
        && type != ClickHouseType.UINT32
        && type != ClickHouseType.FLOAT64) {
      throw new IllegalArgumentException("Numeric type required, got " + type);
    }
    this.expression = expression;
    this.type = type;
  }

  public static NumberFilterRenderer int64(String expression) {
    return new NumberFilterRenderer(expression, ClickHouseType.INT64);
  }

  public static NumberFilterRenderer float64(String expression) {
    return new NumberFilterRenderer(expression, ClickHouseType.FLOAT64);
  }

  @Override
  public Optional<ConditionResult> render(Filter filter, String paramKey) {
    Optional<OperatorKind> operator = FilterRenderers.operatorOf(filter);
    if (operator.isEmpty()) {
      return Optional.empty();
    }
    if (!FilterRenderers.isComparison(operator.get())) {
      FilterRenderers.logUnsupportedOperator(filter, operator.get());
      return Optional.empty();
    }
    Optional<? extends Number> value = readValue(filter);
    if (value.isEmpty()) {
      FilterRenderers.logIncompatibleValue(filter, type.getTypeName());
      return Optional.empty();
    }

    QueryParams params = new QueryParams();
    String placeholder = params.put(paramKey, value.get(), type);
    return OperatorCatalog.render(operator.get(), expression, placeholder)
        .map(condition -> ConditionResult.of(condition, params));
  }

  private Optional<? extends Number> readValue(Filter filter) {
    return switch (type) {
      case INT64 -> filter.value().asLong();
      case UINT32 -> filter.value().asLong().filter(v -> v >= 0 && v <= UINT32_MAX);
      default -> filter.value().asDouble();
    };
  }
}
