package com.evoila.argus.metrics;

import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.time.BucketInterval;
import com.evoila.argus.common.query.time.TimeRange;
import java.util.List;
import java.util.UUID;

/**
 * A validated time-series request.
 *
 * @param groupBy Series split, null for a single series
 * @param interval Bucket width, null to pick one from the window length
 */
public record TimeSeriesQuery(
    UUID projectId,
    Metric metric,
    Aggregation aggregation,
    GroupBy groupBy,
    List<Filter> filters,
    TimeRange timeRange,
    BucketInterval interval) {

  public TimeSeriesQuery {
    filters = List.copyOf(filters);
    timeRange = timeRange == null ? TimeRange.unbounded() : timeRange;
    aggregation = aggregation == null ? metric.getDefaultAggregation() : aggregation;
  }
}
