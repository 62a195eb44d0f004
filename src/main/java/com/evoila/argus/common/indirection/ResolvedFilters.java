package com.evoila.argus.common.indirection;

import com.evoila.argus.common.query.model.Filter;
import java.util.List;

/**
 * Filters after indirection.
 *
 * @param filters Filters to hand to the query builder
 * @param unresolvedNames Names that matched no identifier, in request order
 * @param unsatisfiable Whether a positive filter referenced only unknown names, so no row can
 *     match
 */
public record ResolvedFilters(
    List<Filter> filters, List<String> unresolvedNames, boolean unsatisfiable) {

  public ResolvedFilters {
    filters = List.copyOf(filters);
    unresolvedNames = List.copyOf(unresolvedNames);
  }

  public static ResolvedFilters unchanged(List<Filter> filters) {
    return new ResolvedFilters(filters, List.of(), false);
  }
}
