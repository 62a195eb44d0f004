package com.evoila.argus.events;

import com.evoila.argus.common.indirection.IndirectionRule;
import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.filter.ColumnFilterRegistry;
import com.evoila.argus.common.query.filter.DateTimeFilterRenderer;
import com.evoila.argus.common.query.filter.JsonKeyValueFilterRenderer;
import com.evoila.argus.common.query.filter.StringFilterRenderer;
import com.evoila.argus.common.query.filter.TagsFilterRenderer;
import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.OrderBy;
import com.evoila.argus.common.query.model.TableSource;
import java.util.List;
import java.util.Set;

/** Query definition of the {@code signal_events} table. */
public final class SignalEventQueries {

  public static final String TABLE = "signal_events";
  public static final String TIME_COLUMN = "timestamp";

  /** {@code cluster} holds a cluster name of the signal, filtered as its id in {@code clusters}. */
  public static final IndirectionRule CLUSTER = new IndirectionRule("cluster", "cluster_id");

  public static final List<IndirectionRule> INDIRECTIONS = List.of(CLUSTER);

  public static final Set<String> JSON_COLUMNS = Set.of("payload");

  public static final ColumnFilterRegistry REGISTRY =
      ColumnFilterRegistry.builder()
          .column("id", StringFilterRenderer.uuid("id"))
          .column("trace_id", StringFilterRenderer.uuid("trace_id"))
          .column("name", StringFilterRenderer.of("name"))
          .column("payload", new JsonKeyValueFilterRenderer("payload"))
          .column("timestamp", new DateTimeFilterRenderer("timestamp"))
          .column(CLUSTER.targetColumn(), TagsFilterRenderer.uuids("clusters"))
          .build();

  static final List<String> COLUMNS =
      List.of(
          "id",
          "signal_id AS signalId",
          "trace_id AS traceId",
          "name",
          "payload",
          "formatDateTime(timestamp, '%Y-%m-%dT%H:%i:%S.%fZ') AS eventTime",
          "clusters");

  private SignalEventQueries() {
    // Utility class - prevent instantiation
  }

  public static SelectQueryOptions listOptions(SignalEventQuery query, List<Filter> filters) {
    return SelectQueryOptions.builder()
        .table(TableSource.table(TABLE))
        .columns(COLUMNS)
        .filters(filters)
        .registry(REGISTRY)
        .customCondition(
            ConditionResult.equalTo(
                "project_id", "project_id", query.projectId().toString(), ClickHouseType.UUID))
        .customCondition(
            ConditionResult.equalTo(
                "signal_id", "signal_id", query.signalId().toString(), ClickHouseType.UUID))
        .timeRange(query.timeRange())
        .timeColumn(TIME_COLUMN)
        .ordering(OrderBy.desc("timestamp"))
        .ordering(OrderBy.desc("id"))
        .pagination(query.pagination())
        .build();
  }
}
