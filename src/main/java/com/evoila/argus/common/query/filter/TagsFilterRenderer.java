package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.List;
import java.util.Optional;

/**
 * Array membership on an array column such as {@code tags} or {@code cluster_ids}.
 *
 * <p>A scalar value renders {@code has(column, {key:T})}; a list value renders {@code
 * hasAny(column, {key:Array(T)})}. {@code eq}/{@code has} test membership, {@code ne}/{@code
 * not_has} its negation.
 */
public final class TagsFilterRenderer implements ColumnFilterRenderer {

  private final String arrayColumn;
  private final ClickHouseType elementType;
  private final ClickHouseType arrayType;

  private TagsFilterRenderer(String arrayColumn, ClickHouseType elementType) {
    this.arrayColumn = arrayColumn;
    this.elementType = elementType;
    this.arrayType =
        switch (elementType) {
          case STRING -> ClickHouseType.ARRAY_STRING;
          case UUID -> ClickHouseType.ARRAY_UUID;
          default ->
              throw new IllegalArgumentException("Unsupported array element type " + elementType);
        };
  }

  /** Membership in an {@code Array(String)} column. */
  public static TagsFilterRenderer of(String arrayColumn) {
    return new TagsFilterRenderer(arrayColumn, ClickHouseType.STRING);
  }

  /** Membership in an {@code Array(UUID)} column. */
  public static TagsFilterRenderer uuids(String arrayColumn) {
    return new TagsFilterRenderer(arrayColumn, ClickHouseType.UUID);
  }

  @Override
  public Optional<ConditionResult> render(Filter filter, String paramKey) {
    Optional<OperatorKind> operator = FilterRenderers.operatorOf(filter);
    if (operator.isEmpty()) {
      return Optional.empty();
    }
    boolean negated;
    switch (operator.get()) {
      case EQ, HAS -> negated = false;
      case NE, NOT_HAS -> negated = true;
      default -> {
        FilterRenderers.logUnsupportedOperator(filter, operator.get());
        return Optional.empty();
      }
    }

    List<String> values = filter.value().asStrings();
    if (values.isEmpty()
        || values.stream().anyMatch(v -> !FilterRenderers.isValidText(elementType, v))) {
      FilterRenderers.logIncompatibleValue(filter, elementType.getTypeName());
      return Optional.empty();
    }

    QueryParams params = new QueryParams();
    String condition;
    if (filter.value().isArray()) {
      String placeholder = params.put(paramKey, values, arrayType);
      condition = "hasAny(" + arrayColumn + ", " + placeholder + ")";
    } else {
      String placeholder = params.put(paramKey, values.get(0), elementType);
      condition = "has(" + arrayColumn + ", " + placeholder + ")";
    }
    return Optional.of(ConditionResult.of(negated ? "NOT " + condition : condition, params));
  }
}
