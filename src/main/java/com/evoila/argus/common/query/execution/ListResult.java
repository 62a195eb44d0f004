package com.evoila.argus.common.query.execution;

import java.util.List;

/**
 * One page of rows.
 *
 * @param items Rows of the page
 * @param totalCount Rows matching the predicate across all pages, null when not computed
 * @param unresolvedFilters Friendly names that could not be resolved; when non-empty and {@code
 *     items} is empty the result is empty because of them, not because of the other filters
 */
public record ListResult<T>(List<T> items, Long totalCount, List<String> unresolvedFilters) {

  public ListResult {
    items = List.copyOf(items);
    unresolvedFilters = unresolvedFilters == null ? List.of() : List.copyOf(unresolvedFilters);
  }

  public static <T> ListResult<T> of(List<T> items, Long totalCount) {
    return new ListResult<>(items, totalCount, List.of());
  }

  /** An empty page for a query that cannot match because names did not resolve. */
  public static <T> ListResult<T> unresolved(List<String> unresolvedFilters) {
    return new ListResult<>(List.of(), 0L, unresolvedFilters);
  }

  public ListResult<T> withUnresolvedFilters(List<String> names) {
    return new ListResult<>(items, totalCount, names);
  }
}
