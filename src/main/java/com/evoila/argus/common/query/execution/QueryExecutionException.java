package com.evoila.argus.common.query.execution;

import lombok.Getter;

/**
 * A query the analytical store did not answer.
 *
 * <p>{@link ErrorKind#NON_RETRYABLE} means the store rejected the query itself (bad syntax, unknown
 * column, type mismatch), which points at a bug in query construction. {@link
 * ErrorKind#RETRYABLE} covers connectivity problems, timeouts and overload. Nothing here retries;
 * the kind lets callers decide.
 */
@Getter
public class QueryExecutionException extends RuntimeException {

  public enum ErrorKind {
    RETRYABLE,
    NON_RETRYABLE
  }

  /** -- GETTER -- Whether repeating the same query may succeed */
  private final ErrorKind kind;

  /** -- GETTER -- ClickHouse exception code, or -1 when the error did not come from the server */
  private final int serverCode;

  public QueryExecutionException(ErrorKind kind, int serverCode, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.serverCode = serverCode;
  }

  public static QueryExecutionException retryable(String message, Throwable cause) {
    return new QueryExecutionException(ErrorKind.RETRYABLE, -1, message, cause);
  }

  public static QueryExecutionException nonRetryable(String message, Throwable cause) {
    return new QueryExecutionException(ErrorKind.NON_RETRYABLE, -1, message, cause);
  }

  public boolean isRetryable() {
    return kind == ErrorKind.RETRYABLE;
  }
}
