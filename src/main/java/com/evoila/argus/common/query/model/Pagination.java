package com.evoila.argus.common.query.model;

/**
 * LIMIT/OFFSET window. Callers validate page numbers and sizes before building one; the query
 * builder binds whatever it is given.
 */
public record Pagination(long limit, long offset) {

  /**
   * Zero-based page window.
   *
   * @param pageNumber Page index, 0 for the first page
   * @param pageSize Rows per page
   * @return Pagination with {@code offset = pageNumber * pageSize}
   */
  public static Pagination ofPage(int pageNumber, int pageSize) {
    return new Pagination(pageSize, (long) pageNumber * pageSize);
  }
}
