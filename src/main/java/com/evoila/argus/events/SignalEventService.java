package com.evoila.argus.events;

import com.evoila.argus.common.indirection.FilterIndirectionResolver;
import com.evoila.argus.common.indirection.IndirectionScope;
import com.evoila.argus.common.indirection.ResolvedFilters;
import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.execution.QueryExecutor;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/** Lists events of a signal. Cluster names resolve within the signal, not the whole project. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalEventService {

  private final FilterIndirectionResolver indirectionResolver;
  private final QueryExecutor queryExecutor;

  public Mono<ListResult<Map<String, Object>>> listEvents(SignalEventQuery query) {
    log.debug("Step 1: Resolving cluster filters for signal {}", query.signalId());
    return indirectionResolver
        .resolve(
            IndirectionScope.signal(query.projectId(), query.signalId()),
            query.filters(),
            SignalEventQueries.INDIRECTIONS)
        .flatMap(resolved -> execute(query, resolved));
  }

  private Mono<ListResult<Map<String, Object>>> execute(
      SignalEventQuery query, ResolvedFilters resolved) {
    if (resolved.unsatisfiable()) {
      log.info(
          "No event can match unresolved cluster(s) {}, skipping query",
          resolved.unresolvedNames());
      return Mono.just(ListResult.unresolved(resolved.unresolvedNames()));
    }

    log.debug("Step 2: Building and executing event queries");
    SelectQueryOptions options = SignalEventQueries.listOptions(query, resolved.filters());
    return queryExecutor
        .fetchPage(
            SelectQueryBuilder.build(options),
            SelectQueryBuilder.buildCount(options),
            SignalEventQueries.JSON_COLUMNS)
        .map(page -> page.withUnresolvedFilters(resolved.unresolvedNames()));
  }
}
