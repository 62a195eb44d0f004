package com.evoila.argus.clickhouse;

import com.evoila.argus.common.query.execution.QueryExecutionException;
import com.evoila.argus.common.query.execution.QueryExecutionException.ErrorKind;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import java.net.ConnectException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps transport and server failures to {@link QueryExecutionException} kinds.
 *
 * <p>ClickHouse reports errors as {@code Code: N. DB::Exception: ...}. Codes that describe the
 * query itself are non-retryable regardless of the HTTP status; every other server error, and
 * every failure to reach the server, is retryable.
 */
public final class ClickHouseErrorClassifier {

  private static final Pattern ERROR_CODE = Pattern.compile("Code:\\s*(\\d+)");

  // Errors caused by the query text or its parameters
  private static final Set<Integer> QUERY_ERROR_CODES =
      Set.of(
          6, // CANNOT_PARSE_TEXT
          26, // CANNOT_PARSE_QUOTED_STRING
          27, // CANNOT_PARSE_INPUT_ASSERTION_FAILED
          36, // BAD_ARGUMENTS
          38, // CANNOT_PARSE_DATE
          41, // CANNOT_PARSE_DATETIME
          42, // NUMBER_OF_ARGUMENTS_DOESNT_MATCH
          43, // ILLEGAL_TYPE_OF_ARGUMENT
          46, // UNKNOWN_FUNCTION
          47, // UNKNOWN_IDENTIFIER
          53, // TYPE_MISMATCH
          60, // UNKNOWN_TABLE
          62, // SYNTAX_ERROR
          72, // CANNOT_PARSE_NUMBER
          81, // UNKNOWN_DATABASE
          215, // NOT_AN_AGGREGATE
          376, // CANNOT_PARSE_UUID
          386, // NO_COMMON_TYPE
          456, // UNKNOWN_QUERY_PARAMETER
          457); // BAD_QUERY_PARAMETER

  private ClickHouseErrorClassifier() {
    // Utility class - prevent instantiation
  }

  public static QueryExecutionException classify(Throwable e) {
    if (e instanceof QueryExecutionException executionException) {
      return executionException;
    }
    if (e instanceof WebClientResponseException response) {
      return fromServerError(
          response.getStatusCode().value(), response.getResponseBodyAsString(), e);
    }
    if (isConnectivityFailure(e)) {
      return QueryExecutionException.retryable("ClickHouse unreachable: " + e.getMessage(), e);
    }
    return QueryExecutionException.nonRetryable("ClickHouse query failed: " + e.getMessage(), e);
  }

  /**
   * Classifies an error reported by the server, either as an HTTP error status or inside a 200
   * response whose stream broke off.
   */
  public static QueryExecutionException fromServerError(int httpStatus, String body, Throwable e) {
    int code = errorCode(body);
    String message = "ClickHouse error " + httpStatus + ": " + firstLine(body);
    if (QUERY_ERROR_CODES.contains(code) || (httpStatus >= 400 && httpStatus < 500 && code < 0)) {
      return new QueryExecutionException(ErrorKind.NON_RETRYABLE, code, message, e);
    }
    return new QueryExecutionException(ErrorKind.RETRYABLE, code, message, e);
  }

  static int errorCode(String body) {
    if (body == null) {
      return -1;
    }
    Matcher matcher = ERROR_CODE.matcher(body);
    return matcher.find() ? Integer.parseInt(matcher.group(1)) : -1;
  }

  private static boolean isConnectivityFailure(Throwable e) {
    Throwable current = e;
    while (current != null) {
      if (current instanceof WebClientRequestException
          || current instanceof ConnectException
          || current instanceof TimeoutException
          || current instanceof ReadTimeoutException
          || current instanceof WriteTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static String firstLine(String body) {
    if (body == null || body.isBlank()) {
      return "<empty response>";
    }
    String trimmed = body.strip();
    int newline = trimmed.indexOf('\n');
    return newline < 0 ? trimmed : trimmed.substring(0, newline);
  }
}
