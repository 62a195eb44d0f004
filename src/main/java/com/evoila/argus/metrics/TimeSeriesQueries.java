package com.evoila.argus.metrics;

import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.model.BuiltQuery;
import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.OrderBy;
import com.evoila.argus.common.query.model.TableSource;
import com.evoila.argus.common.query.time.BucketInterval;
import com.evoila.argus.common.query.time.IntervalUnit;
import com.evoila.argus.common.query.time.TimeRangeResolver;
import java.time.Instant;
import java.util.List;

/**
 * Builds bucketed aggregate queries.
 *
 * <p>Rows carry {@code time} (bucket start), the split column when grouped, and {@code value}.
 * With a lower time bound every bucket in the window is present; gap rows have {@code value = 0}
 * and an empty split column.
 */
public final class TimeSeriesQueries {

  public static final String BUCKET_ALIAS = "time";
  public static final String VALUE_ALIAS = "value";

  static final BucketInterval UNBOUNDED_INTERVAL = BucketInterval.of(1, IntervalUnit.DAY);

  private TimeSeriesQueries() {
    // Utility class - prevent instantiation
  }

  public static BuiltQuery build(TimeSeriesQuery query, List<Filter> filters, Instant now) {
    return SelectQueryBuilder.build(options(query, filters, now));
  }

  static SelectQueryOptions options(TimeSeriesQuery query, List<Filter> filters, Instant now) {
    Metric metric = query.metric();
    Metric.Source source = metric.getSource();

    SelectQueryOptions.SelectQueryOptionsBuilder builder =
        SelectQueryOptions.builder()
            .table(TableSource.table(source.getTable()))
            .filters(filters)
            .registry(source.getRegistry())
            .customCondition(
                ConditionResult.equalTo(
                    "project_id",
                    "project_id",
                    query.projectId().toString(),
                    ClickHouseType.UUID))
            .timeRange(query.timeRange())
            .timeColumn(source.getTimeColumn())
            .bucketInterval(intervalFor(query, now))
            .bucketAlias(BUCKET_ALIAS);

    if (query.groupBy() != null) {
      builder
          .column(query.groupBy().selectExpression())
          .grouping(query.groupBy().key())
          .ordering(OrderBy.asc(query.groupBy().key()));
    }
    return builder
        .column(query.aggregation().toSql(metric.getValueExpression()) + " AS " + VALUE_ALIAS)
        .build();
  }

  /** The requested interval, else one sized to the window, else one day. */
  static BucketInterval intervalFor(TimeSeriesQuery query, Instant now) {
    if (query.interval() != null) {
      return query.interval();
    }
    return TimeRangeResolver.window(query.timeRange(), now)
        .map(BucketInterval::auto)
        .orElse(UNBOUNDED_INTERVAL);
  }
}
