package com.evoila.argus.base;

import static org.junit.jupiter.api.Assertions.assertTrue;

import com.evoila.argus.common.query.model.BuiltQuery;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.FilterValue;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Base class for unit tests with shared filter factories and SQL assertions. Provides a consistent
 * setup for all unit tests in the application.
 */
@Tag("unit")
@Tag("fast")
@ExtendWith(MockitoExtension.class)
public abstract class BaseUnitTest {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+):[^}]+}");

  protected static final String PROJECT_ID = "0b8f4a52-6c1e-4e0a-9d44-2f7a3c1b9e01";
  protected static final String OTHER_ID = "5d2c9e7a-1b3f-4c8d-a6e2-7f0b1d3c5a99";

  /** Creates a filter with a string value */
  protected static Filter filter(String column, String operator, String value) {
    return new Filter(column, operator, FilterValue.ofString(value));
  }

  /** Creates a filter with a numeric value */
  protected static Filter numberFilter(String column, String operator, String value) {
    return new Filter(column, operator, FilterValue.ofNumber(new BigDecimal(value)));
  }

  /** Creates a filter with a list value */
  protected static Filter listFilter(String column, String operator, String... values) {
    return new Filter(column, operator, FilterValue.ofStrings(List.of(values)));
  }

  /** Names referenced by {@code {name:Type}} placeholders, in order of first appearance */
  protected static Set<String> placeholderNames(String sql) {
    Set<String> names = new LinkedHashSet<>();
    Matcher matcher = PLACEHOLDER.matcher(sql);
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return names;
  }

  /** Asserts that every placeholder is bound and every bound parameter is referenced */
  protected static void assertPlaceholdersMatchParameters(BuiltQuery query) {
    Set<String> referenced = placeholderNames(query.query());
    Set<String> bound = query.parameters().names();
    assertTrue(
        referenced.equals(bound),
        "Placeholders " + referenced + " should match parameters " + bound);
  }

  /** Asserts that a string contains all of the expected patterns */
  protected static void assertContainsAll(String actual, String... expectedPatterns) {
    for (String pattern : expectedPatterns) {
      assertTrue(
          actual.contains(pattern), "String should contain: " + pattern + "\nActual: " + actual);
    }
  }
}
