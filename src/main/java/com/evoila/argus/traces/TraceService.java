package com.evoila.argus.traces;

import com.evoila.argus.common.indirection.FilterIndirectionResolver;
import com.evoila.argus.common.indirection.IndirectionScope;
import com.evoila.argus.common.indirection.ResolvedFilters;
import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.execution.QueryExecutor;
import com.evoila.argus.search.SearchHits;
import com.evoila.argus.search.SpanSearchService;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Lists traces: runs the text search, resolves pattern names, builds the row and count queries
 * and runs both.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TraceService {

  private final FilterIndirectionResolver indirectionResolver;
  private final QueryExecutor queryExecutor;
  private final SpanSearchService spanSearchService;

  public Mono<ListResult<Map<String, Object>>> listTraces(TraceQuery query) {
    if (query.search() == null) {
      return listResolved(query);
    }
    log.debug("Step 0: Searching spans of project {}", query.projectId());
    return spanSearchService
        .search(query.projectId(), null, query.search(), query.timeRange())
        .flatMap(hits -> listSearchHits(query, hits));
  }

  private Mono<ListResult<Map<String, Object>>> listSearchHits(
      TraceQuery query, SearchHits hits) {
    // explicit trace ids narrow the hits, the search decides the order
    List<String> traceIds =
        query.isPreselected()
            ? hits.traceIds().stream().filter(query.traceIds()::contains).toList()
            : hits.traceIds();
    if (traceIds.isEmpty()) {
      log.debug("Search matched no trace, skipping query");
      return Mono.just(ListResult.of(List.of(), 0L));
    }
    return listResolved(query.withTraceIds(traceIds));
  }

  private Mono<ListResult<Map<String, Object>>> listResolved(TraceQuery query) {
    log.debug("Step 1: Resolving friendly-name filters for project {}", query.projectId());
    return indirectionResolver
        .resolve(
            IndirectionScope.project(query.projectId()),
            query.filters(),
            TraceQueries.INDIRECTIONS)
        .flatMap(resolved -> execute(query, resolved));
  }

  private Mono<ListResult<Map<String, Object>>> execute(
      TraceQuery query, ResolvedFilters resolved) {
    if (resolved.unsatisfiable()) {
      log.info(
          "No trace can match unresolved pattern(s) {}, skipping query",
          resolved.unresolvedNames());
      return Mono.just(ListResult.unresolved(resolved.unresolvedNames()));
    }

    log.debug("Step 2: Building trace queries with {} filter(s)", resolved.filters().size());
    SelectQueryOptions options = TraceQueries.listOptions(query, resolved.filters());

    log.debug("Step 3: Executing trace queries");
    return queryExecutor
        .fetchPage(
            SelectQueryBuilder.build(options),
            SelectQueryBuilder.buildCount(options),
            TraceQueries.JSON_COLUMNS)
        .map(page -> query.isPreselected() ? inSearchOrder(page, query.traceIds()) : page)
        .map(page -> page.withUnresolvedFilters(resolved.unresolvedNames()));
  }

  // Search hits come ranked; keep that rank instead of start time order
  private static ListResult<Map<String, Object>> inSearchOrder(
      ListResult<Map<String, Object>> page, List<String> traceIds) {
    Map<String, Integer> rank = new HashMap<>();
    for (int i = 0; i < traceIds.size(); i++) {
      rank.put(traceIds.get(i), i);
    }
    List<Map<String, Object>> sorted =
        page.items().stream()
            .sorted(
                Comparator.comparingInt(
                    row -> rank.getOrDefault(String.valueOf(row.get("id")), Integer.MAX_VALUE)))
            .toList();
    return new ListResult<>(sorted, page.totalCount(), page.unresolvedFilters());
  }
}
