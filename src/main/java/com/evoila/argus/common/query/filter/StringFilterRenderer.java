package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.operator.OperatorCatalog;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.Optional;

/**
 * Generic renderer for text-like columns.
 *
 * <p>{@code String} columns accept every scalar operator including {@code contains}. Columns typed
 * more narrowly (e.g. {@code UUID}) only accept equality, since a substring match would need an
 * implicit cast.
 */
public final class StringFilterRenderer implements ColumnFilterRenderer {

  private final String columnExpression;
  private final ClickHouseType type;

  public StringFilterRenderer(String columnExpression, ClickHouseType type) {
    if (type.isArray()) {
      throw new IllegalArgumentException("Scalar type required, got " + type);
    }
    this.columnExpression = columnExpression;
    this.type = type;
  }

  public static StringFilterRenderer of(String columnExpression) {
    return new StringFilterRenderer(columnExpression, ClickHouseType.STRING);
  }

  public static StringFilterRenderer uuid(String columnExpression) {
    return new StringFilterRenderer(columnExpression, ClickHouseType.UUID);
  }

  @Override
  public Optional<ConditionResult> render(Filter filter, String paramKey) {
    Optional<OperatorKind> operator = FilterRenderers.operatorOf(filter);
    if (operator.isEmpty()) {
      return Optional.empty();
    }
    OperatorKind op = operator.get();
    if (type != ClickHouseType.STRING && op != OperatorKind.EQ && op != OperatorKind.NE) {
      FilterRenderers.logUnsupportedOperator(filter, op);
      return Optional.empty();
    }
    Optional<String> text =
        filter.value().asText().filter(t -> FilterRenderers.isValidText(type, t));
    if (text.isEmpty()) {
      FilterRenderers.logIncompatibleValue(filter, type.getTypeName());
      return Optional.empty();
    }

    QueryParams params = new QueryParams();
    String placeholder = params.put(paramKey, text.get(), type);
    return OperatorCatalog.render(op, columnExpression, placeholder)
        .map(condition -> ConditionResult.of(condition, params));
  }
}
