package com.evoila.argus.metrics;

import com.evoila.argus.common.indirection.FilterIndirectionResolver;
import com.evoila.argus.common.indirection.IndirectionScope;
import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.execution.QueryExecutor;
import java.time.Clock;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/** Runs bucketed metric queries; the whole series is one page, so no count is computed. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeSeriesService {

  private final FilterIndirectionResolver indirectionResolver;
  private final QueryExecutor queryExecutor;
  private final Clock clock;

  public Mono<ListResult<Map<String, Object>>> series(TimeSeriesQuery query) {
    log.debug(
        "Building {} series of {} for project {}",
        query.aggregation(),
        query.metric(),
        query.projectId());
    return indirectionResolver
        .resolve(
            IndirectionScope.project(query.projectId()),
            query.filters(),
            query.metric().getSource().getIndirections())
        .flatMap(
            resolved -> {
              if (resolved.unsatisfiable()) {
                log.info(
                    "Series of {} is empty, unresolved name(s) {}",
                    query.metric(),
                    resolved.unresolvedNames());
                return Mono.just(ListResult.unresolved(resolved.unresolvedNames()));
              }
              return queryExecutor
                  .fetch(TimeSeriesQueries.build(query, resolved.filters(), clock.instant()))
                  .map(
                      rows ->
                          new ListResult<>(
                              rows, (long) rows.size(), resolved.unresolvedNames()));
            });
  }
}
