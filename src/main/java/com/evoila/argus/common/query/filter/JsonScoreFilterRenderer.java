package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.operator.OperatorCatalog;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.Optional;

/**
 * Numeric comparison on a named member of a JSON score object, for columns like {@code
 * score:accuracy}. The member name after the prefix is bound as {@code <key>_name}, the value as
 * {@code <key>_value}.
 */
public final class JsonScoreFilterRenderer implements ColumnFilterRenderer {

  public static final String PREFIX = "score:";

  private final String jsonColumn;

  public JsonScoreFilterRenderer(String jsonColumn) {
    this.jsonColumn = jsonColumn;
  }

  @Override
  public Optional<ConditionResult> render(Filter filter, String paramKey) {
    String column = filter.column();
    String scoreName = column.startsWith(PREFIX) ? column.substring(PREFIX.length()) : "";
    if (scoreName.isBlank()) {
      FilterRenderers.logIncompatibleValue(filter, "score name");
      return Optional.empty();
    }
    Optional<OperatorKind> operator = FilterRenderers.operatorOf(filter);
    if (operator.isEmpty()) {
      return Optional.empty();
    }
    if (!FilterRenderers.isComparison(operator.get())) {
      FilterRenderers.logUnsupportedOperator(filter, operator.get());
      return Optional.empty();
    }
    Optional<Double> value = filter.value().asDouble();
    if (value.isEmpty()) {
      FilterRenderers.logIncompatibleValue(filter, ClickHouseType.FLOAT64.getTypeName());
      return Optional.empty();
    }

    QueryParams params = new QueryParams();
    String name = params.put(paramKey + "_name", scoreName, ClickHouseType.STRING);
    String placeholder = params.put(paramKey + "_value", value.get(), ClickHouseType.FLOAT64);
    String expression = "JSONExtractFloat(" + jsonColumn + ", " + name + ")";
    return OperatorCatalog.render(operator.get(), expression, placeholder)
        .map(condition -> ConditionResult.of(condition, params));
  }
}
