package com.evoila.argus.common.request;

import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.FilterValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Parses the {@code filter} request parameter into {@link Filter}s.
 *
 * <p>Each parameter value is either one JSON object {@code {"column", "operator", "value"}} or a
 * JSON array of such objects. Elements that are not valid JSON, or lack a column, operator or
 * scalar/list value, are skipped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterParser {

  private final JsonMapper jsonMapper;

  public List<Filter> parse(List<String> rawFilters) {
    if (rawFilters == null || rawFilters.isEmpty()) {
      return Collections.emptyList();
    }
    List<Filter> filters = new ArrayList<>();
    for (String raw : rawFilters) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      readJson(raw).ifPresent(json -> collect(json, filters));
    }
    log.debug("Parsed {} filter(s) from {} parameter value(s)", filters.size(), rawFilters.size());
    return filters;
  }

  private Optional<Object> readJson(String raw) {
    try {
      return Optional.ofNullable(jsonMapper.readValue(raw, Object.class));
    } catch (JacksonException e) {
      log.warn("Skipping unparseable filter '{}': {}", raw, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  private void collect(Object json, List<Filter> filters) {
    if (json instanceof List<?> elements) {
      elements.forEach(element -> toFilter(element).ifPresent(filters::add));
    } else {
      toFilter(json).ifPresent(filters::add);
    }
  }

  private Optional<Filter> toFilter(Object json) {
    if (!(json instanceof Map<?, ?> object)) {
      log.warn("Skipping filter that is not a JSON object: {}", json);
      return Optional.empty();
    }
    Object column = object.get("column");
    Object operator = object.get("operator");
    if (!(column instanceof String c) || c.isBlank() || !(operator instanceof String op)) {
      log.warn("Skipping filter without column or operator: {}", object);
      return Optional.empty();
    }
    Optional<FilterValue> value = FilterValue.fromJson(object.get("value"));
    if (value.isEmpty()) {
      log.warn("Skipping filter on '{}' with unsupported value: {}", c, object.get("value"));
      return Optional.empty();
    }
    return Optional.of(new Filter(c, op, value.get()));
  }
}
