package com.evoila.argus.common.query.execution;

import com.evoila.argus.clickhouse.ClickHouseClient;
import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.model.BuiltQuery;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Runs built queries and materializes their rows.
 *
 * <p>A page is fetched as two independent queries, rows and count, issued concurrently. Failures
 * arrive as {@link QueryExecutionException}; other errors from decoding are wrapped as
 * non-retryable. Cancelling the returned {@link Mono} cancels the in-flight HTTP exchanges.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryExecutor {

  private final ClickHouseClient clickHouseClient;
  private final JsonColumnDecoder jsonColumnDecoder;

  public Mono<List<Map<String, Object>>> fetch(BuiltQuery query) {
    return fetch(query, Set.of());
  }

  /**
   * Executes a row query.
   *
   * @param query The query and its parameters
   * @param jsonColumns Columns whose string values are re-parsed as JSON
   * @return Decoded rows in result order
   */
  public Mono<List<Map<String, Object>>> fetch(BuiltQuery query, Collection<String> jsonColumns) {
    return clickHouseClient
        .query(query)
        .map(rows -> rows.stream().map(row -> jsonColumnDecoder.decode(row, jsonColumns)).toList())
        .onErrorMap(e -> !(e instanceof QueryExecutionException), QueryExecutor::wrap);
  }

  /**
   * Executes a row query and its count query concurrently.
   *
   * @param rowQuery Query for one page of rows
   * @param countQuery Query selecting {@code total_count} under the same predicate
   * @param jsonColumns Columns whose string values are re-parsed as JSON
   * @return Page with its total count
   */
  public Mono<ListResult<Map<String, Object>>> fetchPage(
      BuiltQuery rowQuery, BuiltQuery countQuery, Collection<String> jsonColumns) {
    return Mono.zip(fetch(rowQuery, jsonColumns), fetchCount(countQuery))
        .map(tuple -> ListResult.of(tuple.getT1(), tuple.getT2()))
        .doOnNext(
            result ->
                log.debug(
                    "Fetched {} of {} rows", result.items().size(), result.totalCount()));
  }

  /** Executes a count query and reads its single {@code total_count} value. */
  public Mono<Long> fetchCount(BuiltQuery countQuery) {
    return fetch(countQuery)
        .map(
            rows ->
                rows.isEmpty()
                    ? 0L
                    : toLong(rows.get(0).get(SelectQueryBuilder.TOTAL_COUNT_COLUMN)));
  }

  private static long toLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        throw QueryExecutionException.nonRetryable("Count is not a number: " + text, e);
      }
    }
    throw QueryExecutionException.nonRetryable("Count query returned no total_count", null);
  }

  private static Throwable wrap(Throwable e) {
    log.error("Failed to materialize query result: {}", e.getMessage());
    return QueryExecutionException.nonRetryable(
        "Failed to materialize query result: " + e.getMessage(), e);
  }
}
