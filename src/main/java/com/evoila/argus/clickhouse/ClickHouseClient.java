package com.evoila.argus.clickhouse;

import com.evoila.argus.common.query.model.BuiltQuery;
import java.util.List;
import java.util.Map;
import reactor.core.publisher.Mono;

/** Client for the columnar store: sends a parameterized query and returns its rows. */
public interface ClickHouseClient {

  /**
   * Executes a query.
   *
   * @param query SQL text with {@code {name:Type}} placeholders and the bound parameters
   * @return Rows as column-to-value maps, in result order
   */
  Mono<List<Map<String, Object>>> query(BuiltQuery query);
}
