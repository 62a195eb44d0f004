package com.evoila.argus.spans;

import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.filter.ArrayInFilterRenderer;
import com.evoila.argus.common.query.filter.ColumnFilterRegistry;
import com.evoila.argus.common.query.filter.JsonKeyValueFilterRenderer;
import com.evoila.argus.common.query.filter.NumberFilterRenderer;
import com.evoila.argus.common.query.filter.StatusFilterRenderer;
import com.evoila.argus.common.query.filter.StringFilterRenderer;
import com.evoila.argus.common.query.filter.TagsFilterRenderer;
import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.OrderBy;
import com.evoila.argus.common.query.model.TableSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Query definition of the {@code spans} table. */
public final class SpanQueries {

  public static final String TABLE = "spans";
  public static final String TIME_COLUMN = "start_time";

  /** Span latency in seconds. */
  public static final String LATENCY_EXPRESSION =
      "(toUnixTimestamp64Nano(end_time) - toUnixTimestamp64Nano(start_time)) / 1e9";

  public static final Set<String> JSON_COLUMNS = Set.of("attributes");

  public static final ColumnFilterRegistry REGISTRY =
      ColumnFilterRegistry.builder()
          .column("span_id", StringFilterRenderer.uuid("span_id"))
          .column("trace_id", new ArrayInFilterRenderer("trace_id", ClickHouseType.ARRAY_UUID))
          .column("name", StringFilterRenderer.of("name"))
          .column("span_type", StringFilterRenderer.of("span_type"))
          .column("status", new StatusFilterRenderer("status"))
          .column("model", StringFilterRenderer.of("model"))
          .column("path", StringFilterRenderer.of("path"))
          .column("tags", TagsFilterRenderer.of("tags"))
          .column("input_tokens", NumberFilterRenderer.int64("input_tokens"))
          .column("output_tokens", NumberFilterRenderer.int64("output_tokens"))
          .column("total_tokens", NumberFilterRenderer.int64("total_tokens"))
          .column("input_cost", NumberFilterRenderer.float64("input_cost"))
          .column("output_cost", NumberFilterRenderer.float64("output_cost"))
          .column("total_cost", NumberFilterRenderer.float64("total_cost"))
          .column("latency", NumberFilterRenderer.float64(LATENCY_EXPRESSION))
          .column("attributes", new JsonKeyValueFilterRenderer("attributes"))
          .build();

  static final List<String> COLUMNS =
      List.of(
          "span_id AS spanId",
          "trace_id AS traceId",
          "parent_span_id AS parentSpanId",
          "name",
          "span_type AS spanType",
          "formatDateTime(start_time, '%Y-%m-%dT%H:%i:%S.%fZ') AS startTime",
          "formatDateTime(end_time, '%Y-%m-%dT%H:%i:%S.%fZ') AS endTime",
          LATENCY_EXPRESSION + " AS latency",
          "status",
          "model",
          "path",
          "tags",
          "input_tokens AS inputTokens",
          "output_tokens AS outputTokens",
          "total_tokens AS totalTokens",
          "input_cost AS inputCost",
          "output_cost AS outputCost",
          "total_cost AS totalCost",
          "attributes");

  private SpanQueries() {
    // Utility class - prevent instantiation
  }

  /** Project scope, plus the trace and the searched spans when the query names them. */
  public static List<ConditionResult> scope(SpanQuery query) {
    List<ConditionResult> scope = new ArrayList<>();
    scope.add(
        ConditionResult.equalTo(
            "project_id", "project_id", query.projectId().toString(), ClickHouseType.UUID));
    if (query.traceId() != null) {
      scope.add(
          ConditionResult.equalTo(
              "trace_id", "trace_id", query.traceId().toString(), ClickHouseType.UUID));
    }
    if (!query.spanIds().isEmpty()) {
      scope.add(
          ConditionResult.in("span_id", "span_ids", query.spanIds(), ClickHouseType.ARRAY_UUID));
    }
    return scope;
  }

  public static SelectQueryOptions listOptions(SpanQuery query, List<Filter> filters) {
    return SelectQueryOptions.builder()
        .table(TableSource.table(TABLE))
        .columns(COLUMNS)
        .filters(filters)
        .registry(REGISTRY)
        .customConditions(scope(query))
        .timeRange(query.timeRange())
        .timeColumn(TIME_COLUMN)
        .ordering(OrderBy.desc("start_time"))
        .ordering(OrderBy.desc("span_id"))
        .pagination(query.pagination())
        .build();
  }
}
