package com.evoila.argus.events;

import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.time.TimeRange;
import java.util.List;
import java.util.UUID;

/** A validated request for the events one signal produced. */
public record SignalEventQuery(
    UUID projectId,
    UUID signalId,
    List<Filter> filters,
    TimeRange timeRange,
    Pagination pagination) {

  public SignalEventQuery {
    filters = List.copyOf(filters);
  }
}
