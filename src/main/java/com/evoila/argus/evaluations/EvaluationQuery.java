package com.evoila.argus.evaluations;

import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.Pagination;
import java.util.List;
import java.util.UUID;

/** A validated request for the datapoints of one evaluation; pagination is null for statistics. */
public record EvaluationQuery(
    UUID projectId, UUID evaluationId, List<Filter> filters, Pagination pagination) {

  public EvaluationQuery {
    filters = List.copyOf(filters);
  }
}
