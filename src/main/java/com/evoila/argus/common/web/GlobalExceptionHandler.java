package com.evoila.argus.common.web;

import com.evoila.argus.common.model.GlobalErrorResponse;
import com.evoila.argus.common.query.execution.QueryExecutionException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.webflux.error.ErrorWebExceptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Maps failures to JSON error bodies.
 *
 * <p>Backend failures surface as 502 when the query itself was rejected and 503 when retrying
 * later may succeed. The ClickHouse message is only logged; it can name columns and values of the
 * generated SQL.
 */
@Slf4j
@Configuration
@Order(-2) // ahead of Boot's DefaultErrorWebExceptionHandler
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

  private final JsonMapper jsonMapper;
  private final Clock clock;

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
    ErrorInfo error = determineErrorResponse(exchange, ex);
    log.warn(
        "{} {} failed with {} {}",
        exchange.getRequest().getMethod().name(),
        exchange.getRequest().getPath().value(),
        error.status().value(),
        error.errorCode());
    return write(exchange, error);
  }

  ErrorInfo determineErrorResponse(ServerWebExchange exchange, Throwable ex) {
    if (ex instanceof QueryExecutionException failure) {
      return backendFailure(failure);
    }
    if (ex instanceof JacksonException e) {
      log.warn("Unreadable JSON in request: {}", e.getOriginalMessage());
      return new ErrorInfo(HttpStatus.BAD_REQUEST, "Invalid JSON format", "INVALID_JSON");
    }
    if (ex instanceof IllegalArgumentException e) {
      log.debug("Rejected request {}: {}", exchange.getRequest().getURI(), e.getMessage());
      String message = "Invalid request parameters: " + e.getMessage();
      return new ErrorInfo(HttpStatus.BAD_REQUEST, message, "INVALID_PARAMS");
    }
    if (ex instanceof ResponseStatusException e) {
      // covers routing errors such as 404, 405 and 415 raised by WebFlux itself
      HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
      String reason = e.getReason() != null ? e.getReason() : status.getReasonPhrase();
      return new ErrorInfo(status, reason, status.name());
    }
    log.error("Unhandled error for {}", exchange.getRequest().getPath().value(), ex);
    return new ErrorInfo(
        HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR");
  }

  private ErrorInfo backendFailure(QueryExecutionException failure) {
    if (failure.isRetryable()) {
      log.error("ClickHouse unavailable: {}", failure.getMessage());
      return new ErrorInfo(
          HttpStatus.SERVICE_UNAVAILABLE,
          "Query backend unavailable, retry later",
          "BACKEND_UNAVAILABLE");
    }
    log.error(
        "ClickHouse rejected query (code {}): {}", failure.getServerCode(), failure.getMessage());
    return new ErrorInfo(HttpStatus.BAD_GATEWAY, "Query failed", "QUERY_FAILED");
  }

  private Mono<Void> write(ServerWebExchange exchange, ErrorInfo error) {
    ServerHttpResponse response = exchange.getResponse();
    response.setStatusCode(error.status());
    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

    GlobalErrorResponse body =
        new GlobalErrorResponse(
            error.status().getReasonPhrase(),
            error.message(),
            error.status().value(),
            error.errorCode(),
            clock.instant().toString(),
            exchange.getRequest().getPath().value());

    byte[] bytes;
    try {
      bytes = jsonMapper.writeValueAsBytes(body);
    } catch (JacksonException e) {
      log.error("Could not serialize error body", e);
      String fallback =
          "{\"status\":" + error.status().value() + ",\"errorCode\":\"" + error.errorCode() + "\"}";
      bytes = fallback.getBytes(StandardCharsets.UTF_8);
    }
    return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
  }

  record ErrorInfo(HttpStatus status, String message, String errorCode) {}
}
