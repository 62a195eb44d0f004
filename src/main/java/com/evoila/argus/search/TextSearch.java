package com.evoila.argus.search;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * A free-text search over spans.
 *
 * @param text Substring to look for, matched case-insensitively
 * @param fields Fields to look in, in declaration order and never empty
 */
public record TextSearch(String text, List<SearchField> fields) {

  public TextSearch {
    fields =
        fields == null || fields.isEmpty()
            ? List.of(SearchField.values())
            : fields.stream().distinct().sorted(Comparator.naturalOrder()).toList();
  }

  /**
   * Reads the {@code search} and {@code searchIn} request parameters.
   *
   * @return The search, or null when {@code search} is absent or blank
   * @throws IllegalArgumentException if a {@code searchIn} value is not a searchable field
   */
  public static TextSearch fromRequest(String search, Collection<String> searchIn) {
    if (search == null || search.isBlank()) {
      return null;
    }
    List<SearchField> fields =
        searchIn == null
            ? List.of()
            : searchIn.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(SearchField::fromString)
                .toList();
    return new TextSearch(search.trim(), fields);
  }
}
