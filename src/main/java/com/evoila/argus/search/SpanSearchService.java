package com.evoila.argus.search;

import com.evoila.argus.common.config.ArgusProperties;
import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.execution.QueryExecutor;
import com.evoila.argus.common.query.time.TimeRange;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Resolves a free-text search to span and trace ids. List queries then pre-select those ids, so
 * their filters and time range still apply on top of the search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpanSearchService {

  private final QueryExecutor queryExecutor;
  private final ArgusProperties properties;

  /**
   * Finds spans matching a search.
   *
   * @param projectId Project to search in
   * @param traceId Trace to search in, null for the whole project
   * @param search Text and fields to search
   * @param timeRange Window of span start times; ignored when a trace is given
   * @return Hits capped at the configured maximum, best match first
   */
  public Mono<SearchHits> search(
      UUID projectId, UUID traceId, TextSearch search, TimeRange timeRange) {
    int maxHits = properties.getQuery().getSearchMaxHits();
    log.debug("Searching spans of project {} in {}", projectId, search.fields());
    return queryExecutor
        .fetch(
            SelectQueryBuilder.build(
                SpanSearchQueries.options(projectId, traceId, search, timeRange, maxHits)))
        .map(SearchHits::fromRows)
        .doOnNext(
            hits ->
                log.debug(
                    "Search matched {} span(s) in {} trace(s)",
                    hits.spanIds().size(),
                    hits.traceIds().size()));
  }
}
