package com.evoila.argus.common.indirection;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Looks cluster names up in the {@code clusters} table on the bounded elastic scheduler. */
@Slf4j
@RequiredArgsConstructor
public class JdbcClusterNameLookup implements ClusterNameLookup {

  private static final String PROJECT_QUERY =
      "SELECT id FROM clusters WHERE project_id = :projectId AND name = :name"
          + " ORDER BY created_at ASC LIMIT 1";

  private static final String SIGNAL_QUERY =
      "SELECT id FROM clusters WHERE project_id = :projectId AND signal_id = :signalId"
          + " AND name = :name ORDER BY created_at ASC LIMIT 1";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Mono<String> findClusterId(IndirectionScope scope, String name) {
    return Mono.fromCallable(() -> queryClusterId(scope, name))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(ids -> ids.isEmpty() ? Mono.<String>empty() : Mono.just(ids.get(0)))
        .doOnError(
            e ->
                log.error(
                    "Cluster lookup failed for '{}' in {}: {}", name, scope, e.getMessage()));
  }

  private List<String> queryClusterId(IndirectionScope scope, String name) {
    MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("projectId", scope.projectId()).addValue("name", name);
    if (scope.signal().isPresent()) {
      params.addValue("signalId", scope.signal().get());
      return jdbcTemplate.queryForList(SIGNAL_QUERY, params, String.class);
    }
    return jdbcTemplate.queryForList(PROJECT_QUERY, params, String.class);
  }
}
