package com.evoila.argus.common.query.execution;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Re-parses columns that the store returns as JSON text ({@code metadata}, {@code attributes},
 * {@code scores}). Text that is not valid JSON is kept as is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonColumnDecoder {

  private final JsonMapper jsonMapper;

  public Map<String, Object> decode(Map<String, Object> row, Collection<String> jsonColumns) {
    if (jsonColumns.isEmpty()) {
      return row;
    }
    Map<String, Object> decoded = new LinkedHashMap<>(row);
    for (String column : jsonColumns) {
      if (decoded.get(column) instanceof String text) {
        decoded.put(column, parse(column, text));
      }
    }
    return decoded;
  }

  private Object parse(String column, String text) {
    if (text.isBlank()) {
      return text;
    }
    try {
      return jsonMapper.readValue(text, Object.class);
    } catch (JacksonException e) {
      log.debug("Column '{}' is not valid JSON, keeping raw text: {}", column, e.getMessage());
      return text;
    }
  }
}
