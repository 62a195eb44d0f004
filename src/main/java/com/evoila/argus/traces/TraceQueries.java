package com.evoila.argus.traces;

import com.evoila.argus.common.indirection.IndirectionRule;
import com.evoila.argus.common.query.builder.SelectQueryOptions;
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
import java.util.List;
import java.util.Set;

/** Query definition of the {@code traces} table. */
public final class TraceQueries {

  public static final String TABLE = "traces";
  public static final String TIME_COLUMN = "start_time";

  public static final String DURATION_EXPRESSION =
      "(toUnixTimestamp64Nano(end_time) - toUnixTimestamp64Nano(start_time)) / 1e9";

  /** {@code pattern} holds a cluster name, filtered as its id in {@code cluster_ids}. */
  public static final IndirectionRule PATTERN = new IndirectionRule("pattern", "pattern_id");

  public static final List<IndirectionRule> INDIRECTIONS = List.of(PATTERN);

  public static final Set<String> JSON_COLUMNS = Set.of("metadata");

  public static final ColumnFilterRegistry REGISTRY =
      ColumnFilterRegistry.builder()
          .column("id", StringFilterRenderer.uuid("id"))
          .column("session_id", StringFilterRenderer.of("session_id"))
          .column("user_id", StringFilterRenderer.of("user_id"))
          .column("status", new StatusFilterRenderer("status"))
          .column("trace_type", StringFilterRenderer.of("trace_type"))
          .column("tags", TagsFilterRenderer.of("tags"))
          .column("total_cost", NumberFilterRenderer.float64("total_cost"))
          .column("input_cost", NumberFilterRenderer.float64("input_cost"))
          .column("output_cost", NumberFilterRenderer.float64("output_cost"))
          .column("total_tokens", NumberFilterRenderer.int64("total_tokens"))
          .column("input_tokens", NumberFilterRenderer.int64("input_tokens"))
          .column("output_tokens", NumberFilterRenderer.int64("output_tokens"))
          .column("duration", NumberFilterRenderer.float64(DURATION_EXPRESSION))
          .column("metadata", new JsonKeyValueFilterRenderer("metadata"))
          .column("top_span_type", StringFilterRenderer.of("top_span_type"))
          .column("top_span_name", StringFilterRenderer.of("top_span_name"))
          .column(PATTERN.targetColumn(), TagsFilterRenderer.uuids("cluster_ids"))
          .build();

  static final List<String> COLUMNS =
      List.of(
          "id",
          "formatDateTime(start_time, '%Y-%m-%dT%H:%i:%S.%fZ') AS startTime",
          "formatDateTime(end_time, '%Y-%m-%dT%H:%i:%S.%fZ') AS endTime",
          "session_id AS sessionId",
          "metadata",
          "tags",
          "input_tokens AS inputTokens",
          "output_tokens AS outputTokens",
          "total_tokens AS totalTokens",
          "input_cost AS inputCost",
          "output_cost AS outputCost",
          "total_cost AS totalCost",
          "top_span_id AS topSpanId",
          "top_span_name AS topSpanName",
          "top_span_type AS topSpanType",
          "trace_type AS traceType",
          "status",
          "user_id AS userId");

  private TraceQueries() {
    // Utility class - prevent instantiation
  }

  /**
   * Options for a trace list query.
   *
   * @param query The validated request
   * @param filters Filters after indirection
   */
  public static SelectQueryOptions listOptions(TraceQuery query, List<Filter> filters) {
    SelectQueryOptions.SelectQueryOptionsBuilder options =
        SelectQueryOptions.builder()
            .table(TableSource.table(TABLE))
            .columns(COLUMNS)
            .filters(filters)
            .registry(REGISTRY)
            .customCondition(
                ConditionResult.equalTo(
                    "project_id", "project_id", query.projectId().toString(), ClickHouseType.UUID))
            .customCondition(
                ConditionResult.equalTo(
                    "trace_type", "trace_type", query.traceType().name(), ClickHouseType.STRING))
            .timeRange(query.timeRange())
            .timeColumn(TIME_COLUMN)
            .ordering(OrderBy.desc("start_time"))
            .ordering(OrderBy.desc("id"))
            .pagination(query.pagination());

    if (query.isPreselected()) {
      options.customCondition(
          ConditionResult.in("id", "trace_ids", query.traceIds(), ClickHouseType.ARRAY_UUID));
    }
    return options.build();
  }
}
