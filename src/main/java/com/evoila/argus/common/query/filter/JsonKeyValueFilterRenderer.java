package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.Optional;

/**
 * Matches {@code key=value} against a JSON object stored as a string column.
 *
 * <p>String members match through {@code simpleJSONExtractString}, numbers and booleans through
 * their raw JSON text, so {@code retries=3} and {@code env=prod} both work regardless of how the
 * value was written. Binds {@code <key>_key} and {@code <key>_val}.
 */
public final class JsonKeyValueFilterRenderer implements ColumnFilterRenderer {

  private final String jsonColumn;

  public JsonKeyValueFilterRenderer(String jsonColumn) {
    this.jsonColumn = jsonColumn;
  }

  @Override
  public Optional<ConditionResult> render(Filter filter, String paramKey) {
    Optional<OperatorKind> operator = FilterRenderers.operatorOf(filter);
    if (operator.isEmpty()) {
      return Optional.empty();
    }
    OperatorKind op = operator.get();
    if (op != OperatorKind.EQ && op != OperatorKind.NE) {
      FilterRenderers.logUnsupportedOperator(filter, op);
      return Optional.empty();
    }
    Optional<String[]> pair = filter.value().asText().flatMap(JsonKeyValueFilterRenderer::split);
    if (pair.isEmpty()) {
      FilterRenderers.logIncompatibleValue(filter, "key=value pair");
      return Optional.empty();
    }

    QueryParams params = new QueryParams();
    String key = params.put(paramKey + "_key", pair.get()[0], ClickHouseType.STRING);
    String val = params.put(paramKey + "_val", pair.get()[1], ClickHouseType.STRING);
    String condition =
        "(simpleJSONExtractString("
            + jsonColumn
            + ", "
            + key
            + ") = "
            + val
            + " OR simpleJSONExtractRaw("
            + jsonColumn
            + ", "
            + key
            + ") = "
            + val
            + ")";
    return Optional.of(
        ConditionResult.of(op == OperatorKind.NE ? "NOT " + condition : condition, params));
  }

  private static Optional<String[]> split(String text) {
    int separator = text.indexOf('=');
    if (separator <= 0 || separator == text.length() - 1) {
      return Optional.empty();
    }
    return Optional.of(new String[] {text.substring(0, separator), text.substring(separator + 1)});
  }
}
