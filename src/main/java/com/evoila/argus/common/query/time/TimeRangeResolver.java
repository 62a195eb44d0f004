package com.evoila.argus.common.query.time;

import com.evoila.argus.common.query.model.ClickHouseType;
import com.evoila.argus.common.query.model.ConditionResult;
import com.evoila.argus.common.query.model.QueryParams;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a {@link TimeRange} into a time predicate, and for bucketed queries also into a bucket
 * expression and a {@code WITH FILL} clause.
 *
 * <p>Precedence is explicit range, then {@code pastHours}, then no condition. Dates are bound as
 * {@code DateTime64(9)} parameters in UTC; the hour count is bound as {@code UInt32}.
 */
@Slf4j
public final class TimeRangeResolver {

  public static final String START_TIME_PARAM = "start_time";
  public static final String END_TIME_PARAM = "end_time";
  public static final String PAST_HOURS_PARAM = "past_hours";

  private static final DateTimeFormatter CLICKHOUSE_DATETIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSSSSS");

  // Accepts "2024-05-01T10:00:00", "2024-05-01 10:00:00" and fractional seconds
  private static final DateTimeFormatter LOCAL_DATETIME =
      new DateTimeFormatterBuilder()
          .appendPattern("yyyy-MM-dd[['T'][' ']HH:mm[:ss]]")
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
          .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
          .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
          .toFormatter();

  private TimeRangeResolver() {
    // Utility class - prevent instantiation
  }

  /**
   * Resolves the time predicate for a range.
   *
   * @param range The requested range
   * @param timeColumn Column the predicate applies to (code-supplied)
   * @return Condition and parameters, or empty when the range is unbounded
   */
  public static Optional<ConditionResult> resolve(TimeRange range, String timeColumn) {
    if (range == null) {
      return Optional.empty();
    }
    if (range.isExplicit()) {
      return resolveExplicit(range, timeColumn);
    }
    if (range.isRelative()) {
      QueryParams params = new QueryParams();
      String hours = params.put(PAST_HOURS_PARAM, range.pastHours(), ClickHouseType.UINT32);
      return Optional.of(
          ConditionResult.of(timeColumn + " >= now() - INTERVAL " + hours + " HOUR", params));
    }
    return Optional.empty();
  }

  /**
   * Resolves a range for a bucketed query.
   *
   * <p>The fill clause is produced only when the resolved condition has a lower bound; without
   * one there is nothing to fill from and callers get naturally sparse buckets.
   */
  public static BucketedTimeRange resolveWithFill(
      TimeRange range, String timeColumn, BucketInterval interval) {
    String bucketExpression = bucketExpression(timeColumn, interval);
    Optional<ConditionResult> condition = resolve(range, timeColumn);
    Optional<String> fillClause = condition.flatMap(c -> fillClause(c, interval));
    if (condition.isPresent() && fillClause.isEmpty()) {
      log.debug("No lower time bound for '{}', gap filling disabled", timeColumn);
    }
    return new BucketedTimeRange(bucketExpression, condition, fillClause);
  }

  /** Bucket start for each row, always typed as DateTime so it lines up with the fill bounds. */
  public static String bucketExpression(String timeColumn, BucketInterval interval) {
    return "toStartOfInterval(toDateTime(" + timeColumn + "), " + interval.toSql() + ")";
  }

  /**
   * Normalizes an ISO-8601 date or date-time to the ClickHouse {@code DateTime64(9)} text form in
   * UTC. Values without an offset are taken as UTC.
   */
  public static Optional<String> normalizeDateTime(String value) {
    return parseInstant(value).map(TimeRangeResolver::format);
  }

  /**
   * Length of the window a range covers, with an open explicit end taken as {@code now}.
   *
   * @return Window length, empty for unbounded ranges or unparseable dates
   */
  public static Optional<Duration> window(TimeRange range, Instant now) {
    if (range == null) {
      return Optional.empty();
    }
    if (range.isRelative()) {
      return range.relativeDuration();
    }
    if (!range.isExplicit()) {
      return Optional.empty();
    }
    Optional<Instant> start = parseInstant(range.startDate());
    if (start.isEmpty()) {
      return Optional.empty();
    }
    Instant end = range.endDate() == null ? now : parseInstant(range.endDate()).orElse(now);
    Duration window = Duration.between(start.get(), end);
    return window.isNegative() ? Optional.of(Duration.ZERO) : Optional.of(window);
  }

  static Optional<Instant> parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String text = value.trim();
    try {
      return Optional.of(OffsetDateTime.parse(text).toInstant());
    } catch (DateTimeParseException ignored) {
      // not an offset date-time, try local forms
    }
    try {
      return Optional.of(LocalDateTime.parse(text, LOCAL_DATETIME).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      log.warn("Ignoring unparseable date '{}'", value);
      return Optional.empty();
    }
  }

  private static Optional<ConditionResult> resolveExplicit(TimeRange range, String timeColumn) {
    Optional<String> start = normalizeDateTime(range.startDate());
    Optional<String> end = normalizeDateTime(range.endDate());

    List<String> conditions = new ArrayList<>();
    QueryParams params = new QueryParams();

    start.ifPresent(
        s ->
            conditions.add(
                timeColumn
                    + " >= "
                    + params.put(START_TIME_PARAM, s, ClickHouseType.DATETIME64)));
    if (end.isPresent()) {
      conditions.add(
          timeColumn + " <= " + params.put(END_TIME_PARAM, end.get(), ClickHouseType.DATETIME64));
    } else if (start.isPresent()) {
      conditions.add(timeColumn + " <= now()");
    }

    if (conditions.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(ConditionResult.of(String.join(" AND ", conditions), params));
  }

  private static Optional<String> fillClause(ConditionResult condition, BucketInterval interval) {
    QueryParams params = condition.params();
    String from;
    if (params.contains(START_TIME_PARAM)) {
      from = "toDateTime(" + ClickHouseType.DATETIME64.placeholder(START_TIME_PARAM) + ")";
    } else if (params.contains(PAST_HOURS_PARAM)) {
      from = "now() - INTERVAL " + ClickHouseType.UINT32.placeholder(PAST_HOURS_PARAM) + " HOUR";
    } else {
      return Optional.empty();
    }
    String to =
        params.contains(END_TIME_PARAM)
            ? "toDateTime(" + ClickHouseType.DATETIME64.placeholder(END_TIME_PARAM) + ")"
            : "now()";

    String step = interval.toSql();
    return Optional.of(
        "WITH FILL FROM toStartOfInterval("
            + from
            + ", "
            + step
            + ") TO toStartOfInterval("
            + to
            + ", "
            + step
            + ") + "
            + step
            + " STEP "
            + step);
  }

  private static String format(Instant instant) {
    return CLICKHOUSE_DATETIME.format(instant.atOffset(ZoneOffset.UTC));
  }
}
