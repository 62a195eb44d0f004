package com.evoila.argus.metrics;

import com.evoila.argus.common.indirection.IndirectionRule;
import com.evoila.argus.common.query.filter.ColumnFilterRegistry;
import com.evoila.argus.spans.SpanQueries;
import com.evoila.argus.traces.TraceQueries;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Charted measures. Each one fixes its source table, the value it aggregates, and the columns a
 * series may be split by.
 */
@Getter
public enum Metric {
  SPAN_COUNT(Source.SPANS, "1", Aggregation.COUNT),
  TOKENS(Source.SPANS, "total_tokens", Aggregation.SUM),
  COST(Source.SPANS, "total_cost", Aggregation.SUM),
  LATENCY(Source.SPANS, SpanQueries.LATENCY_EXPRESSION, Aggregation.P90),
  TRACE_COUNT(Source.TRACES, "1", Aggregation.COUNT),
  TRACE_DURATION(Source.TRACES, TraceQueries.DURATION_EXPRESSION, Aggregation.P90);

  private final Source source;
  private final String valueExpression;
  private final Aggregation defaultAggregation;

  Metric(Source source, String valueExpression, Aggregation defaultAggregation) {
    this.source = source;
    this.valueExpression = valueExpression;
    this.defaultAggregation = defaultAggregation;
  }

  /**
   * Looks up a series split for this metric.
   *
   * @throws IllegalArgumentException if the column may not be grouped on
   */
  public Optional<GroupBy> groupBy(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    GroupBy groupBy = source.groupings.get(name.trim());
    if (groupBy == null) {
      throw new IllegalArgumentException(
          "Cannot group " + name() + " by '" + name + "', allowed: " + source.groupings.keySet());
    }
    return Optional.of(groupBy);
  }

  /** @throws IllegalArgumentException if the metric is missing or unknown */
  public static Metric fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("metric is required");
    }
    return Arrays.stream(values())
        .filter(metric -> metric.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + value));
  }

  /** Table a metric reads, with its filter registry and name indirections. */
  @Getter
  public enum Source {
    SPANS(
        SpanQueries.TABLE,
        SpanQueries.TIME_COLUMN,
        SpanQueries.REGISTRY,
        List.of(),
        Map.of(
            "model", GroupBy.column("model"),
            "name", GroupBy.column("name"),
            "span_type", GroupBy.column("span_type"),
            "path", GroupBy.column("path"))),
    TRACES(
        TraceQueries.TABLE,
        TraceQueries.TIME_COLUMN,
        TraceQueries.REGISTRY,
        TraceQueries.INDIRECTIONS,
        Map.of(
            "status",
                GroupBy.expression("if(status = 'error', 'error', 'success')", "traceStatus"),
            "user_id", GroupBy.column("user_id"),
            "top_span_name", GroupBy.column("top_span_name")));

    private final String table;
    private final String timeColumn;
    private final ColumnFilterRegistry registry;
    private final List<IndirectionRule> indirections;
    private final Map<String, GroupBy> groupings;

    Source(
        String table,
        String timeColumn,
        ColumnFilterRegistry registry,
        List<IndirectionRule> indirections,
        Map<String, GroupBy> groupings) {
      this.table = table;
      this.timeColumn = timeColumn;
      this.registry = registry;
      this.indirections = indirections;
      this.groupings = groupings;
    }
  }
}
