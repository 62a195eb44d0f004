package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.operator.OperatorCatalog;
import com.evoila.argus.common.query.operator.OperatorKind;
import com.evoila.argus.common.query.time.TimeRangeResolver;
import java.util.Optional;

/** Renders comparisons against a {@code DateTime64} column; values are ISO-8601 in UTC. */
public final class DateTimeFilterRenderer implements ColumnFilterRenderer {

  private final String columnExpression;

  public DateTimeFilterRenderer(String columnExpression) {
    this.columnExpression = columnExpression;
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
    Optional<String> value = filter.value().asText().flatMap(TimeRangeResolver::normalizeDateTime);
    if (value.isEmpty()) {
      FilterRenderers.logIncompatibleValue(filter, "date-time");
      return Optional.empty();
    }

    QueryParams params = new QueryParams();
    String placeholder = params.put(paramKey, value.get(), ClickHouseType.DATETIME64);
    return OperatorCatalog.render(operator.get(), columnExpression, placeholder)
        .map(condition -> ConditionResult.of(condition, params));
  }
}
