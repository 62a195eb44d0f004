package com.evoila.argus.traces;

import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.time.TimeRange;
import com.evoila.argus.search.TextSearch;
import java.util.List;
import java.util.UUID;

/**
 * A validated trace list request.
 *
 * @param traceIds Ids pre-selected by the caller or by {@code search}, in rank order
 * @param search Free-text search over the traces' spans, null when none was requested
 */
public record TraceQuery(
    UUID projectId,
    TraceType traceType,
    List<String> traceIds,
    TextSearch search,
    List<Filter> filters,
    TimeRange timeRange,
    Pagination pagination) {

  public TraceQuery {
    traceIds = List.copyOf(traceIds);
    filters = List.copyOf(filters);
  }

  public boolean isPreselected() {
    return !traceIds.isEmpty();
  }

  public TraceQuery withTraceIds(List<String> ids) {
    return new TraceQuery(projectId, traceType, ids, search, filters, timeRange, pagination);
  }
}
