package com.evoila.argus.spans;

import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.execution.QueryExecutor;
import com.evoila.argus.search.SpanSearchService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class SpanService {

  private final QueryExecutor queryExecutor;
  private final SpanSearchService spanSearchService;

  /** Lists spans; a text search first narrows them to its hits, which are then paged as usual. */
  public Mono<ListResult<Map<String, Object>>> listSpans(SpanQuery query) {
    if (query.search() == null) {
      return list(query);
    }
    return spanSearchService
        .search(query.projectId(), query.traceId(), query.search(), query.timeRange())
        .flatMap(
            hits -> {
              if (hits.isEmpty()) {
                log.debug("Search matched no span in project {}", query.projectId());
                return Mono.just(ListResult.<Map<String, Object>>of(List.of(), 0L));
              }
              return list(query.withSpanIds(hits.spanIds()));
            });
  }

  private Mono<ListResult<Map<String, Object>>> list(SpanQuery query) {
    SelectQueryOptions options = SpanQueries.listOptions(query, query.filters());
    log.debug(
        "Listing spans for project {} with {} filter(s)",
        query.projectId(),
        query.filters().size());
    return queryExecutor.fetchPage(
        SelectQueryBuilder.build(options),
        SelectQueryBuilder.buildCount(options),
        SpanQueries.JSON_COLUMNS);
  }
}
