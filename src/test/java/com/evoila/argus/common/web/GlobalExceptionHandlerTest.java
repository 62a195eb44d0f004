package com.evoila.argus.common.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.evoila.argus.base.BaseUnitTest;
import com.evoila.argus.common.config.JacksonConfig;
import com.evoila.argus.common.query.execution.QueryExecutionException;
import com.evoila.argus.common.query.execution.QueryExecutionException.ErrorKind;
import com.evoila.argus.common.web.GlobalExceptionHandler.ErrorInfo;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.MethodNotAllowedException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;
import reactor.test.StepVerifier;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

class GlobalExceptionHandlerTest extends BaseUnitTest {

  private final JsonMapper jsonMapper = new JacksonConfig().jsonMapper();
  private final GlobalExceptionHandler handler =
      new GlobalExceptionHandler(
          jsonMapper, Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));

  private static MockServerWebExchange exchange() {
    return MockServerWebExchange.from(
        MockServerHttpRequest.get("/api/v1/projects/p/traces?pageSize=10"));
  }

  private ErrorInfo errorFor(Throwable ex) {
    return handler.determineErrorResponse(exchange(), ex);
  }

  @Nested
  @DisplayName("Backend failures")
  class BackendFailures {

    @Test
    void retryableFailureShouldBeServiceUnavailable() {
      ErrorInfo info = errorFor(QueryExecutionException.retryable("timeout", null));

      assertEquals(HttpStatus.SERVICE_UNAVAILABLE, info.status());
      assertEquals("BACKEND_UNAVAILABLE", info.errorCode());
    }

    @Test
    void rejectedQueryShouldBeBadGatewayWithoutLeakingDetails() {
      ErrorInfo info =
          errorFor(
              new QueryExecutionException(
                  ErrorKind.NON_RETRYABLE, 47, "Missing columns: 'secret_col'", null));

      assertEquals(HttpStatus.BAD_GATEWAY, info.status());
      assertEquals("QUERY_FAILED", info.errorCode());
      assertThat(info.message()).doesNotContain("secret_col");
    }
  }

  @Nested
  @DisplayName("Request failures")
  class RequestFailures {

    @Test
    void invalidParametersShouldBeBadRequest() {
      ErrorInfo info = errorFor(new IllegalArgumentException("pageSize must be positive: 0"));

      assertEquals(HttpStatus.BAD_REQUEST, info.status());
      assertEquals("INVALID_PARAMS", info.errorCode());
      assertThat(info.message()).contains("pageSize");
    }

    @Test
    void malformedJsonShouldBeBadRequest() {
      JacksonException parseError =
          assertThrows(JacksonException.class, () -> jsonMapper.readTree("{broken"));

      assertEquals("INVALID_JSON", errorFor(parseError).errorCode());
    }

    @Test
    void protocolErrorsShouldKeepTheirStatus() {
      assertEquals(
          HttpStatus.METHOD_NOT_ALLOWED,
          errorFor(new MethodNotAllowedException(HttpMethod.DELETE, Set.of(HttpMethod.GET)))
              .status());
      assertEquals(
          HttpStatus.UNSUPPORTED_MEDIA_TYPE,
          errorFor(new UnsupportedMediaTypeStatusException("text/csv")).status());
      assertEquals(
          HttpStatus.NOT_FOUND,
          errorFor(new ResponseStatusException(HttpStatus.NOT_FOUND, "No such route")).status());
    }

    @Test
    void unexpectedErrorsShouldBeInternal() {
      ErrorInfo info = errorFor(new IllegalStateException("bug"));

      assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, info.status());
      assertEquals("INTERNAL_ERROR", info.errorCode());
    }
  }

  @Test
  void handleShouldWriteJsonBody() {
    MockServerWebExchange exchange = exchange();

    StepVerifier.create(
            handler.handle(exchange, new IllegalArgumentException("Unknown metric: throughput")))
        .verifyComplete();

    assertEquals(HttpStatus.BAD_REQUEST, exchange.getResponse().getStatusCode());
    assertEquals(
        MediaType.APPLICATION_JSON, exchange.getResponse().getHeaders().getContentType());
    StepVerifier.create(exchange.getResponse().getBodyAsString())
        .assertNext(
            body ->
                assertThat(body)
                    .contains("\"errorCode\":\"INVALID_PARAMS\"")
                    .contains("\"status\":400")
                    .contains("\"timestamp\":\"2024-05-01T12:00:00Z\"")
                    .contains("\"path\":\"/api/v1/projects/p/traces\"")
                    .contains("Unknown metric: throughput"))
        .verifyComplete();
  }
}
