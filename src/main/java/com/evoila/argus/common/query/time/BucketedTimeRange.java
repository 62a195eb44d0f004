package com.evoila.argus.common.query.time;

import com.evoila.argus.common.query.model.ConditionResult;
import java.util.Optional;

/**
 * Resolved time range for a bucketed query.
 *
 * @param bucketExpression Expression that truncates the time column to its bucket start
 * @param condition Time predicate, empty when the range is unbounded
 * @param fillClause {@code WITH FILL ...} clause, empty when no bound range exists to fill
 */
public record BucketedTimeRange(
    String bucketExpression, Optional<ConditionResult> condition, Optional<String> fillClause) {}
