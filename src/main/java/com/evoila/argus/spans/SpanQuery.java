package com.evoila.argus.spans;

import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.time.TimeRange;
import com.evoila.argus.search.TextSearch;
import java.util.List;
import java.util.UUID;

/**
 * A validated span list request; {@code traceId} narrows the list to one trace when set.
 *
 * @param search Free-text search, null when none was requested
 * @param spanIds Spans pre-selected by {@code search}, empty before it ran
 */
public record SpanQuery(
    UUID projectId,
    UUID traceId,
    TextSearch search,
    List<String> spanIds,
    List<Filter> filters,
    TimeRange timeRange,
    Pagination pagination) {

  public SpanQuery {
    spanIds = spanIds == null ? List.of() : List.copyOf(spanIds);
    filters = List.copyOf(filters);
  }

  public SpanQuery withSpanIds(List<String> ids) {
    return new SpanQuery(projectId, traceId, search, ids, filters, timeRange, pagination);
  }
}
