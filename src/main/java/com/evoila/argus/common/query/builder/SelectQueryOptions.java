package com.evoila.argus.common.query.builder;

import com.evoila.argus.common.query.filter.ColumnFilterRegistry;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.OrderBy;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.model.TableSource;
import com.evoila.argus.common.query.time.BucketInterval;
import com.evoila.argus.common.query.time.TimeRange;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * Complete, immutable input for one SELECT.
 *
 * <p>Table, column, grouping and ordering expressions come from code. Only {@link #getFilters()}
 * and {@link #getHavingFilters()} carry request input, and their columns are used purely as
 * registry keys.
 *
 * <p>Setting {@link #getBucketInterval()} makes the query a time series: the bucket expression is
 * selected as {@link #getBucketAlias()}, grouped and ordered on first, and gap filled when the time
 * range has a lower bound.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class SelectQueryOptions {

  @NonNull private final TableSource table;

  @Singular private final List<String> columns;

  @Singular private final List<Filter> filters;

  private final ColumnFilterRegistry registry;

  @Singular private final List<ConditionResult> customConditions;

  private final TimeRange timeRange;

  @Builder.Default private final String timeColumn = "start_time";

  private final BucketInterval bucketInterval;

  @Builder.Default private final String bucketAlias = "time";

  @Singular private final List<String> groupings;

  @Singular private final List<Filter> havingFilters;

  private final ColumnFilterRegistry havingRegistry;

  @Singular private final List<ConditionResult> customHavingConditions;

  @Singular private final List<OrderBy> orderings;

  private final Pagination pagination;

  public boolean isBucketed() {
    return bucketInterval != null;
  }
}
