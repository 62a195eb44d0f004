package com.evoila.argus.common.query.filter;

import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import java.util.Optional;

/**
 * Renders one filter on one logical column into a condition with its bound parameters.
 *
 * <p>Implementations bind every value through a parameter whose name starts with {@code
 * paramKey}, and return empty when the operator or value does not fit the column. An empty result
 * drops the filter.
 */
@FunctionalInterface
public interface ColumnFilterRenderer {

  /**
   * @param filter The filter to render
   * @param paramKey Unique parameter name (or prefix, for renderers that bind several values)
   * @return Condition and parameters, or empty when the filter is a no-op
   */
  Optional<ConditionResult> render(Filter filter, String paramKey);
}
