package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.List;
import java.util.Optional;

/** Set membership of a scalar column: {@code column IN ({key:Array(T)})}. */
public final class ArrayInFilterRenderer implements ColumnFilterRenderer {

  private final String columnExpression;
  private final ClickHouseType arrayType;

  public ArrayInFilterRenderer(String columnExpression, ClickHouseType arrayType) {
    if (!arrayType.isArray()) {
      throw new IllegalArgumentException("Array type required, got " + arrayType);
    }
    this.columnExpression = columnExpression;
    this.arrayType = arrayType;
  }

  @Override
  public Optional<ConditionResult> render(Filter filter, String paramKey) {
    Optional<OperatorKind> operator = FilterRenderers.operatorOf(filter);
    if (operator.isEmpty()) {
      return Optional.empty();
    }
    String keyword;
    switch (operator.get()) {
      case EQ, HAS -> keyword = " IN ";
      case NE, NOT_HAS -> keyword = " NOT IN ";
      default -> {
        FilterRenderers.logUnsupportedOperator(filter, operator.get());
        return Optional.empty();
      }
    }
    List<String> values = filter.value().asStrings();
    ClickHouseType elementType =
        arrayType == ClickHouseType.ARRAY_UUID ? ClickHouseType.UUID : ClickHouseType.STRING;
    if (values.isEmpty()
        || values.stream().anyMatch(v -> !FilterRenderers.isValidText(elementType, v))) {
      FilterRenderers.logIncompatibleValue(filter, arrayType.getTypeName());
      return Optional.empty();
    }

    QueryParams params = new QueryParams();
    String placeholder = params.put(paramKey, values, arrayType);
    return Optional.of(
        ConditionResult.of(columnExpression + keyword + "(" + placeholder + ")", params));
  }
}
