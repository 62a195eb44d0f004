package com.evoila.argus.common.query.builder;

import com.evoila.argus.common.query.filter.ColumnFilterRegistry;
import com.evoila.argus.common.query.filter.ColumnFilterRenderer;
import com.evoila.argus.common.query.model.BuiltQuery;
import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.OrderBy;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.model.QueryParams;
import com.evoila.argus.common.query.time.BucketedTimeRange;
import com.evoila.argus.common.query.time.TimeRangeResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Assembles parameterized ClickHouse SELECTs from {@link SelectQueryOptions}.
 *
 * <p>Pure and deterministic: the same options always produce the same text and parameters. Every
 * filter value travels through a named parameter, never through the SQL text.
 *
 * <p>Clause order: WHERE (filters, then custom conditions, then time range), GROUP BY, HAVING,
 * ORDER BY (with the fill clause on the bucket term), LIMIT/OFFSET.
 */
@Slf4j
public final class SelectQueryBuilder {

  public static final String LIMIT_PARAM = "limit";
  public static final String OFFSET_PARAM = "offset";
  public static final String TOTAL_COUNT_COLUMN = "total_count";

  private static final String HAVING_KEY_PREFIX = "having_";
  private static final Pattern UNSAFE_PARAM_CHARS = Pattern.compile("[^A-Za-z0-9_]");

  private SelectQueryBuilder() {
    // Utility class - prevent instantiation
  }

  /**
   * Builds the row query.
   *
   * @param options Query options
   * @return SQL text and its parameters
   * @throws IllegalArgumentException if no column is selected
   */
  public static BuiltQuery build(SelectQueryOptions options) {
    QueryParams params = new QueryParams();
    Optional<BucketedTimeRange> bucket = resolveBucket(options);

    List<String> columns = new ArrayList<>();
    bucket.ifPresent(b -> columns.add(b.bucketExpression() + " AS " + options.getBucketAlias()));
    columns.addAll(options.getColumns());
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("At least one column must be selected");
    }

    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", columns));
    appendFromAndPredicate(sql, options, bucket, params);
    appendOrderBy(sql, options, bucket);
    appendPagination(sql, options.getPagination(), params);

    log.debug("Built query: {}", sql);
    return new BuiltQuery(sql.toString(), params);
  }

  /**
   * Builds the count query for the same options: identical FROM/WHERE/GROUP BY/HAVING text and
   * parameters, no ordering or pagination. Grouped queries count their groups.
   */
  public static BuiltQuery buildCount(SelectQueryOptions options) {
    QueryParams params = new QueryParams();
    Optional<BucketedTimeRange> bucket = resolveBucket(options);

    StringBuilder sql = new StringBuilder();
    if (isGrouped(options, bucket)) {
      String inner =
          bucket.map(b -> b.bucketExpression() + " AS " + options.getBucketAlias()).orElse("1");
      StringBuilder subquery = new StringBuilder("SELECT ").append(inner);
      appendFromAndPredicate(subquery, options, bucket, params);
      sql.append("SELECT count() AS ")
          .append(TOTAL_COUNT_COLUMN)
          .append(" FROM (")
          .append(subquery)
          .append(")");
    } else {
      sql.append("SELECT count() AS ").append(TOTAL_COUNT_COLUMN);
      appendFromAndPredicate(sql, options, bucket, params);
    }

    log.debug("Built count query: {}", sql);
    return new BuiltQuery(sql.toString(), params);
  }

  /**
   * Parameter name for the filter at {@code index}: the column with anything outside {@code
   * [A-Za-z0-9_]} replaced, then the index.
   */
  public static String paramKey(String column, int index) {
    String safe = UNSAFE_PARAM_CHARS.matcher(column == null ? "" : column).replaceAll("_");
    if (safe.isEmpty() || Character.isDigit(safe.charAt(0))) {
      safe = "f_" + safe;
    }
    return safe + "_" + index;
  }

  private static void appendFromAndPredicate(
      StringBuilder sql,
      SelectQueryOptions options,
      Optional<BucketedTimeRange> bucket,
      QueryParams params) {
    sql.append(" FROM ").append(options.getTable().expression());
    params.putAll(options.getTable().params());

    List<String> where = new ArrayList<>();
    renderFilters(options.getFilters(), options.getRegistry(), "", where, params);
    addConditions(options.getCustomConditions(), where, params);
    timeCondition(options, bucket).ifPresent(c -> addConditions(List.of(c), where, params));
    if (!where.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", where));
    }

    List<String> groupBy = new ArrayList<>();
    bucket.ifPresent(b -> groupBy.add(options.getBucketAlias()));
    groupBy.addAll(options.getGroupings());
    if (!groupBy.isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", groupBy));
    }

    List<String> having = new ArrayList<>();
    renderFilters(
        options.getHavingFilters(), options.getHavingRegistry(), HAVING_KEY_PREFIX, having, params);
    addConditions(options.getCustomHavingConditions(), having, params);
    if (!having.isEmpty()) {
      sql.append(" HAVING ").append(String.join(" AND ", having));
    }
  }

  // Single place where unregistered columns and no-op renders are dropped
  private static void renderFilters(
      List<Filter> filters,
      ColumnFilterRegistry registry,
      String keyPrefix,
      List<String> conditions,
      QueryParams params) {
    for (int index = 0; index < filters.size(); index++) {
      Filter filter = filters.get(index);
      Optional<ColumnFilterRenderer> renderer =
          registry == null ? Optional.empty() : registry.lookup(filter.column());
      if (renderer.isEmpty()) {
        log.warn("Column '{}' is not filterable here, filter skipped", filter.column());
        continue;
      }
      renderer
          .get()
          .render(filter, keyPrefix + paramKey(filter.column(), index))
          .ifPresent(result -> addConditions(List.of(result), conditions, params));
    }
  }

  private static void addConditions(
      List<ConditionResult> results, List<String> conditions, QueryParams params) {
    for (ConditionResult result : results) {
      conditions.add(result.condition());
      params.putAll(result.params());
    }
  }

  private static Optional<BucketedTimeRange> resolveBucket(SelectQueryOptions options) {
    if (!options.isBucketed()) {
      return Optional.empty();
    }
    return Optional.of(
        TimeRangeResolver.resolveWithFill(
            options.getTimeRange(), options.getTimeColumn(), options.getBucketInterval()));
  }

  private static Optional<ConditionResult> timeCondition(
      SelectQueryOptions options, Optional<BucketedTimeRange> bucket) {
    if (bucket.isPresent()) {
      return bucket.get().condition();
    }
    return TimeRangeResolver.resolve(options.getTimeRange(), options.getTimeColumn());
  }

  private static void appendOrderBy(
      StringBuilder sql, SelectQueryOptions options, Optional<BucketedTimeRange> bucket) {
    List<String> terms = new ArrayList<>();
    // WITH FILL binds to the term it follows, so the bucket goes first
    bucket.ifPresent(
        b ->
            terms.add(
                options.getBucketAlias()
                    + " ASC"
                    + b.fillClause().map(fill -> " " + fill).orElse("")));
    options.getOrderings().stream().map(OrderBy::toSql).forEach(terms::add);
    if (!terms.isEmpty()) {
      sql.append(" ORDER BY ").append(String.join(", ", terms));
    }
  }

  private static void appendPagination(
      StringBuilder sql, Pagination pagination, QueryParams params) {
    if (pagination == null) {
      return;
    }
    sql.append(" LIMIT ")
        .append(params.put(LIMIT_PARAM, pagination.limit(), ClickHouseType.UINT32))
        .append(" OFFSET ")
        .append(params.put(OFFSET_PARAM, pagination.offset(), ClickHouseType.UINT32));
  }

  private static boolean isGrouped(SelectQueryOptions options, Optional<BucketedTimeRange> bucket) {
    return bucket.isPresent() || !options.getGroupings().isEmpty();
  }
}
