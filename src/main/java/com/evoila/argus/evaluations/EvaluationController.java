package com.evoila.argus.evaluations;

import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.request.FilterParser;
import com.evoila.argus.common.request.RequestParameters;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/projects/{projectId}/evaluations/{evaluationId}")
@RequiredArgsConstructor
public class EvaluationController {

  private final EvaluationService evaluationService;
  private final FilterParser filterParser;
  private final RequestParameters requestParameters;

  @GetMapping("/datapoints")
  public Mono<ListResult<Map<String, Object>>> listDatapoints(
      @PathVariable("projectId") String projectId,
      @PathVariable("evaluationId") String evaluationId,
      @RequestParam(name = "filter", required = false) List<String> filter,
      @RequestParam(name = "pageNumber", required = false) Integer pageNumber,
      @RequestParam(name = "pageSize", required = false) Integer pageSize) {
    log.debug("EvaluationController: Listing datapoints of evaluation {}", evaluationId);
    return evaluationService.listDatapoints(
        new EvaluationQuery(
            RequestParameters.uuid("projectId", projectId),
            RequestParameters.uuid("evaluationId", evaluationId),
            filterParser.parse(filter),
            requestParameters.pagination(pageNumber, pageSize)));
  }

  @GetMapping("/statistics")
  public Mono<Map<String, ScoreStatistics>> statistics(
      @PathVariable("projectId") String projectId,
      @PathVariable("evaluationId") String evaluationId,
      @RequestParam(name = "filter", required = false) List<String> filter) {
    return evaluationService.statistics(
        new EvaluationQuery(
            RequestParameters.uuid("projectId", projectId),
            RequestParameters.uuid("evaluationId", evaluationId),
            filterParser.parse(filter),
            null));
  }
}
