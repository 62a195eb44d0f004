package com.evoila.argus.evaluations;

import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.builder.SelectQueryOptions;
import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.execution.QueryExecutor;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

  private final QueryExecutor queryExecutor;

  public Mono<ListResult<Map<String, Object>>> listDatapoints(EvaluationQuery query) {
    log.debug("Listing datapoints of evaluation {}", query.evaluationId());
    SelectQueryOptions options = EvaluationQueries.listOptions(query);
    return queryExecutor.fetchPage(
        SelectQueryBuilder.build(options),
        SelectQueryBuilder.buildCount(options),
        EvaluationQueries.JSON_COLUMNS);
  }

  /** Per-score average and distribution over all datapoints matching the filters. */
  public Mono<Map<String, ScoreStatistics>> statistics(EvaluationQuery query) {
    log.debug("Computing score statistics of evaluation {}", query.evaluationId());
    return queryExecutor
        .fetch(
            SelectQueryBuilder.build(EvaluationQueries.scoresOptions(query)),
            Set.of(EvaluationQueries.SCORES_COLUMN))
        .map(EvaluationStatistics::compute);
  }
}
