package com.evoila.argus.common.request;

import com.evoila.argus.common.config.ArgusProperties;
import com.evoila.argus.common.query.model.Pagination;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Validates structural request parameters before they reach the query builder. Violations throw
 * {@link IllegalArgumentException}, which the error handler turns into 400.
 */
@Component
@RequiredArgsConstructor
public class RequestParameters {

  // OFFSET is bound as UInt32
  private static final long MAX_OFFSET = 0xFFFFFFFFL;

  private final ArgusProperties properties;

  /**
   * Builds a page window from optional request values.
   *
   * @param pageNumber Zero-based page, defaults to 0
   * @param pageSize Page size, defaults to the configured default and is capped at the maximum
   */
  public Pagination pagination(Integer pageNumber, Integer pageSize) {
    ArgusProperties.QueryConfig config = properties.getQuery();
    int page = pageNumber == null ? 0 : pageNumber;
    int size = pageSize == null ? config.getDefaultPageSize() : pageSize;
    if (page < 0) {
      throw new IllegalArgumentException("pageNumber must not be negative: " + page);
    }
    if (size <= 0) {
      throw new IllegalArgumentException("pageSize must be positive: " + size);
    }
    int capped = Math.min(size, config.getMaxPageSize());
    if ((long) page * capped > MAX_OFFSET) {
      throw new IllegalArgumentException("pageNumber is too large: " + page);
    }
    return Pagination.ofPage(page, capped);
  }

  /** Row window used when results are pre-selected by id: one page of up to the search cap. */
  public Pagination preselectionWindow() {
    return new Pagination(properties.getQuery().getSearchMaxHits(), 0);
  }

  public static UUID uuid(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
    try {
      return UUID.fromString(value.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(name + " is not a valid UUID: " + value, e);
    }
  }

  public static List<String> uuids(String name, Collection<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream()
        .filter(value -> value != null && !value.isBlank())
        .map(value -> uuid(name, value).toString())
        .distinct()
        .toList();
  }
}
