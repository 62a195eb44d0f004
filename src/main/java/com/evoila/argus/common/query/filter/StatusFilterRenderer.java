package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.operator.OperatorCatalog;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps the {@code success}/{@code error} domain values onto the raw status column.
 *
 * <p>Only errors are recorded explicitly; every other raw status counts as success. So {@code
 * status eq success} becomes {@code status != 'error'} and {@code status ne success} becomes
 * {@code status = 'error'}. Other values are compared literally through a parameter.
 */
public final class StatusFilterRenderer implements ColumnFilterRenderer {

  static final String SUCCESS = "success";
  static final String ERROR = "error";

  private final String columnExpression;

  public StatusFilterRenderer(String columnExpression) {
    this.columnExpression = columnExpression;
  }

  @Override
  public Optional<ConditionResult> render(Filter filter, String paramKey) {
    Optional<OperatorKind> operator = FilterRenderers.operatorOf(filter);
    Optional<String> value = filter.value().asText();
    if (operator.isEmpty()) {
      return Optional.empty();
    }
    if (value.isEmpty()) {
      FilterRenderers.logIncompatibleValue(filter, "status");
      return Optional.empty();
    }

    OperatorKind op = operator.get();
    String normalized = value.get().trim().toLowerCase(Locale.ROOT);
    if (SUCCESS.equals(normalized) || ERROR.equals(normalized)) {
      if (op != OperatorKind.EQ && op != OperatorKind.NE) {
        FilterRenderers.logUnsupportedOperator(filter, op);
        return Optional.empty();
      }
      // success is the absence of error, so it flips the comparison
      boolean matchesError =
          SUCCESS.equals(normalized) ? op == OperatorKind.NE : op == OperatorKind.EQ;
      String comparison = matchesError ? " = " : " != ";
      return Optional.of(ConditionResult.of(columnExpression + comparison + "'" + ERROR + "'"));
    }

    QueryParams params = new QueryParams();
    String placeholder = params.put(paramKey, value.get(), ClickHouseType.STRING);
    return OperatorCatalog.render(op, columnExpression, placeholder)
        .map(condition -> ConditionResult.of(condition, params));
  }
}
