package com.evoila.argus.clickhouse;

import com.evoila.argus.common.config.ArgusProperties;
import com.evoila.argus.common.query.execution.QueryExecutionException;
import com.evoila.argus.common.query.model.BuiltQuery;
import com.evoila.argus.common.query.model.QueryParameter;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * {@link ClickHouseClient} over the ClickHouse HTTP interface.
 *
 * <p>The SQL goes in the POST body with {@code FORMAT JSONEachRow} appended; every bound value
 * goes in a {@code param_<name>} query parameter, so values never reach the SQL text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClickHouseHttpClient implements ClickHouseClient {

  static final String FORMAT_SUFFIX = " FORMAT JSONEachRow";
  static final String PARAM_PREFIX = "param_";

  private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

  private final WebClient clickHouseWebClient;
  private final ArgusProperties properties;
  private final JsonMapper jsonMapper;

  @Override
  public Mono<List<Map<String, Object>>> query(BuiltQuery query) {
    logRequest(query);
    ArgusProperties.ClickHouseConfig config = properties.getClickhouse();

    return clickHouseWebClient
        .post()
        .uri(uriBuilder -> buildUri(uriBuilder, config, query))
        .header("X-ClickHouse-User", config.getUser())
        .header("X-ClickHouse-Key", config.getPassword())
        .contentType(MediaType.TEXT_PLAIN)
        .bodyValue(query.query() + FORMAT_SUFFIX)
        .retrieve()
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(this::parseRows)
        .doOnNext(rows -> log.debug("ClickHouse returned {} rows", rows.size()))
        .doOnError(e -> logError(e, query))
        .onErrorMap(ClickHouseErrorClassifier::classify);
  }

  private URI buildUri(
      UriBuilder uriBuilder, ArgusProperties.ClickHouseConfig config, BuiltQuery query) {
    // Values are passed as URI variables so braces and ampersands are encoded, not expanded
    Map<String, Object> variables = new HashMap<>();
    uriBuilder
        .path("/")
        .queryParam("database", "{database}")
        .queryParam("output_format_json_quote_64bit_integers", "0");
    variables.put("database", config.getDatabase());

    int index = 0;
    for (Map.Entry<String, QueryParameter> entry : query.parameters().asMap().entrySet()) {
      String variable = "v" + index++;
      uriBuilder.queryParam(PARAM_PREFIX + entry.getKey(), "{" + variable + "}");
      variables.put(variable, ClickHouseParameterSerializer.serialize(entry.getValue()));
    }
    return uriBuilder.build(variables);
  }

  private List<Map<String, Object>> parseRows(String body) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (String line : body.split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      // An error after the first rows arrives inline, the status is already 200. Every
      // JSONEachRow row is an object, so anything else is the server's error text.
      if (!line.startsWith("{")) {
        throw ClickHouseErrorClassifier.fromServerError(200, line, null);
      }
      try {
        rows.add(jsonMapper.readValue(line, ROW_TYPE));
      } catch (JacksonException e) {
        throw QueryExecutionException.nonRetryable(
            "Unreadable ClickHouse row: " + e.getOriginalMessage(), e);
      }
    }
    return rows;
  }

  private void logRequest(BuiltQuery query) {
    log.debug("Executing ClickHouse query: {}", query.query());
    log.debug("Parameters: {}", query.parameters().names());
  }

  private void logError(Throwable e, BuiltQuery query) {
    log.error("ClickHouse query failed: {}", e.getMessage());
    log.error("Query: {}", query.query());
    if (e instanceof WebClientResponseException webEx) {
      log.error("HTTP Status: {}", webEx.getStatusCode());
      log.error("Response Body: {}", webEx.getResponseBodyAsString());
    }
  }
}
