package com.evoila.argus.evaluations;

import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.filter.ColumnFilterRegistry;
import com.evoila.argus.common.query.filter.JsonKeyValueFilterRenderer;
import com.evoila.argus.common.query.filter.JsonScoreFilterRenderer;
import com.evoila.argus.common.query.filter.NumberFilterRenderer;
import com.evoila.argus.common.query.filter.StringFilterRenderer;
import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.OrderBy;
import com.evoila.argus.common.query.model.TableSource;
import java.util.List;
import java.util.Set;

/**
 * Query definition of {@code evaluation_datapoints}, joined to {@code traces} for duration, cost
 * and status.
 *
 * <p>Datapoints are ordered by their index within the evaluation, ties broken by creation time.
 */
public final class EvaluationQueries {

  static final TableSource SOURCE =
      TableSource.table("evaluation_datapoints a LEFT JOIN traces t ON t.id = a.trace_id");

  static final String DURATION_EXPRESSION =
      "(toUnixTimestamp64Nano(t.end_time) - toUnixTimestamp64Nano(t.start_time)) / 1e9";

  public static final String SCORES_COLUMN = "scores";

  public static final Set<String> JSON_COLUMNS =
      Set.of("data", "target", "metadata", "executorOutput", SCORES_COLUMN);

  public static final ColumnFilterRegistry REGISTRY =
      ColumnFilterRegistry.builder()
          .column("index", NumberFilterRenderer.int64("a.index"))
          .column("traceId", StringFilterRenderer.uuid("a.trace_id"))
          .column("metadata", new JsonKeyValueFilterRenderer("a.metadata"))
          .column("duration", NumberFilterRenderer.float64(DURATION_EXPRESSION))
          .column("cost", NumberFilterRenderer.float64("t.total_cost"))
          .prefix(JsonScoreFilterRenderer.PREFIX, new JsonScoreFilterRenderer("a.scores"))
          .build();

  static final List<String> COLUMNS =
      List.of(
          "a.id AS id",
          "a.evaluation_id AS evaluationId",
          "a.index AS index",
          "a.trace_id AS traceId",
          "a.group_id AS groupId",
          "a.data AS data",
          "a.target AS target",
          "a.metadata AS metadata",
          "a.executor_output AS executorOutput",
          "a.scores AS " + SCORES_COLUMN,
          "formatDateTime(a.created_at, '%Y-%m-%dT%H:%i:%S.%fZ') AS createdAt",
          "formatDateTime(t.start_time, '%Y-%m-%dT%H:%i:%S.%fZ') AS startTime",
          "formatDateTime(t.end_time, '%Y-%m-%dT%H:%i:%S.%fZ') AS endTime",
          DURATION_EXPRESSION + " AS duration",
          "t.total_cost AS cost",
          "t.status AS status");

  private EvaluationQueries() {
    // Utility class - prevent instantiation
  }

  public static SelectQueryOptions listOptions(EvaluationQuery query) {
    return baseOptions(query).columns(COLUMNS).pagination(query.pagination()).build();
  }

  /** Only the score column of every matching datapoint, for statistics. */
  public static SelectQueryOptions scoresOptions(EvaluationQuery query) {
    return baseOptions(query).column("a.scores AS " + SCORES_COLUMN).build();
  }

  private static SelectQueryOptions.SelectQueryOptionsBuilder baseOptions(EvaluationQuery query) {
    return SelectQueryOptions.builder()
        .table(SOURCE)
        .filters(query.filters())
        .registry(REGISTRY)
        .customCondition(
            ConditionResult.equalTo(
                "a.project_id", "project_id", query.projectId().toString(), ClickHouseType.UUID))
        .customCondition(
            ConditionResult.equalTo(
                "a.evaluation_id",
                "evaluation_id",
                query.evaluationId().toString(),
                ClickHouseType.UUID))
        .ordering(OrderBy.asc("a.index"))
        .ordering(OrderBy.asc("a.created_at"));
  }
}
