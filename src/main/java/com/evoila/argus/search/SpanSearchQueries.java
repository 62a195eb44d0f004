package com.evoila.argus.search;

import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.OrderBy;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.model.TableSource;
import com.evoila.argus.common.query.operator.OperatorCatalog;
import com.evoila.argus.common.query.operator.OperatorKind;
import com.evoila.argus.common.query.time.TimeRange;
import java.util.UUID;
import java.util.stream.Collectors;

/** Query that finds spans whose text contains the searched substring, newest first. */
public final class SpanSearchQueries {

  static final String TABLE = "spans";
  static final String TRACE_ID_ALIAS = "traceId";
  static final String SPAN_ID_ALIAS = "spanId";
  static final String TEXT_PARAM = "search_text";

  private SpanSearchQueries() {
    // Utility class - prevent instantiation
  }

  /**
   * @param traceId Trace to search in, null to search the whole project
   * @param maxHits Cap on returned spans
   */
  public static SelectQueryOptions options(
      UUID projectId, UUID traceId, TextSearch search, TimeRange timeRange, long maxHits) {
    SelectQueryOptions.SelectQueryOptionsBuilder builder =
        SelectQueryOptions.builder()
            .table(TableSource.table(TABLE))
            .column("trace_id AS " + TRACE_ID_ALIAS)
            .column("span_id AS " + SPAN_ID_ALIAS)
            .customCondition(
                ConditionResult.equalTo(
                    "project_id", "project_id", projectId.toString(), ClickHouseType.UUID))
            .customCondition(textCondition(search))
            .timeRange(traceId == null ? timeRange : TimeRange.unbounded())
            .timeColumn("start_time")
            .ordering(OrderBy.desc("start_time"))
            .ordering(OrderBy.desc("span_id"))
            .pagination(new Pagination(maxHits, 0));
    if (traceId != null) {
      builder.customCondition(
          ConditionResult.equalTo("trace_id", "trace_id", traceId.toString(), ClickHouseType.UUID));
    }
    return builder.build();
  }

  // One bound value, matched against every field
  static ConditionResult textCondition(TextSearch search) {
    QueryParams params = new QueryParams();
    String placeholder = params.put(TEXT_PARAM, search.text(), ClickHouseType.STRING);
    String condition =
        search.fields().stream()
            .map(
                field ->
                    OperatorCatalog.render(OperatorKind.CONTAINS, field.getColumn(), placeholder)
                        .orElseThrow())
            .collect(Collectors.joining(" OR ", "(", ")"));
    return ConditionResult.of(condition, params);
  }
}
