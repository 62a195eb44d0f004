package com.evoila.argus.search;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ids of matching spans and of the traces they belong to, best match first and without
 * duplicates.
 */
public record SearchHits(List<String> traceIds, List<String> spanIds) {

  public SearchHits {
    traceIds = List.copyOf(traceIds);
    spanIds = List.copyOf(spanIds);
  }

  static SearchHits fromRows(List<Map<String, Object>> rows) {
    Set<String> traceIds = new LinkedHashSet<>();
    Set<String> spanIds = new LinkedHashSet<>();
    for (Map<String, Object> row : rows) {
      traceIds.add(String.valueOf(row.get(SpanSearchQueries.TRACE_ID_ALIAS)));
      spanIds.add(String.valueOf(row.get(SpanSearchQueries.SPAN_ID_ALIAS)));
    }
    return new SearchHits(List.copyOf(traceIds), List.copyOf(spanIds));
  }

  public boolean isEmpty() {
    return spanIds.isEmpty();
  }
}
