package com.evoila.argus.common.query.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-table mapping from logical column names to renderers.
 *
 * <p>Lookup order is exact name, then the first registered prefix that matches, then the default
 * renderer if one was set. Registries are immutable and built once per table.
 */
public final class ColumnFilterRegistry {

  private final Map<String, ColumnFilterRenderer> columns;
  private final Map<String, ColumnFilterRenderer> prefixes;
  private final ColumnFilterRenderer defaultRenderer;

  private ColumnFilterRegistry(Builder builder) {
    this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columns));
    this.prefixes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.prefixes));
    this.defaultRenderer = builder.defaultRenderer;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Finds the renderer for a column.
   *
   * @param column Logical column name from a filter
   * @return The renderer, or empty when the column is not filterable on this table
   */
  public Optional<ColumnFilterRenderer> lookup(String column) {
    if (column == null) {
      return Optional.empty();
    }
    ColumnFilterRenderer exact = columns.get(column);
    if (exact != null) {
      return Optional.of(exact);
    }
    return prefixes.entrySet().stream()
        .filter(entry -> column.startsWith(entry.getKey()))
        .map(Map.Entry::getValue)
        .findFirst()
        .or(() -> Optional.ofNullable(defaultRenderer));
  }

  public boolean isRegistered(String column) {
    return lookup(column).isPresent();
  }

  public static final class Builder {
    private final Map<String, ColumnFilterRenderer> columns = new LinkedHashMap<>();
    private final Map<String, ColumnFilterRenderer> prefixes = new LinkedHashMap<>();
    private ColumnFilterRenderer defaultRenderer;

    private Builder() {}

    public Builder column(String name, ColumnFilterRenderer renderer) {
      if (columns.putIfAbsent(name, renderer) != null) {
        throw new IllegalStateException("Column already registered: " + name);
      }
      return this;
    }

    public Builder prefix(String prefix, ColumnFilterRenderer renderer) {
      if (prefixes.putIfAbsent(prefix, renderer) != null) {
        throw new IllegalStateException("Prefix already registered: " + prefix);
      }
      return this;
    }

    public Builder defaultRenderer(ColumnFilterRenderer renderer) {
      this.defaultRenderer = renderer;
      return this;
    }

    public ColumnFilterRegistry build() {
      return new ColumnFilterRegistry(this);
    }
  }
}
