package com.evoila.argus.metrics;

import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.time.BucketInterval;
import com.evoila.argus.common.query.time.IntervalUnit;
import com.evoila.argus.common.query.time.TimeRange;
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
@RequestMapping("/api/v1/projects/{projectId}/metrics")
@RequiredArgsConstructor
public class TimeSeriesController {

  private final TimeSeriesService timeSeriesService;
  private final FilterParser filterParser;

  @GetMapping("/{metric}")
  public Mono<ListResult<Map<String, Object>>> series(
      @PathVariable("projectId") String projectId,
      @PathVariable("metric") String metricName,
      @RequestParam(name = "aggregation", required = false) String aggregation,
      @RequestParam(name = "groupBy", required = false) String groupBy,
      @RequestParam(name = "intervalValue", required = false) Integer intervalValue,
      @RequestParam(name = "intervalUnit", required = false) String intervalUnit,
      @RequestParam(name = "filter", required = false) List<String> filter,
      @RequestParam(name = "pastHours", required = false) String pastHours,
      @RequestParam(name = "startDate", required = false) String startDate,
      @RequestParam(name = "endDate", required = false) String endDate) {
    log.debug("TimeSeriesController: {} series for project {}", metricName, projectId);
    Metric metric = Metric.fromString(metricName);
    return timeSeriesService.series(
        new TimeSeriesQuery(
            RequestParameters.uuid("projectId", projectId),
            metric,
            Aggregation.fromString(aggregation, metric.getDefaultAggregation()),
            metric.groupBy(groupBy).orElse(null),
            filterParser.parse(filter),
            TimeRange.fromRequest(pastHours, startDate, endDate),
            interval(intervalValue, intervalUnit)));
  }

  private static BucketInterval interval(Integer value, String unit) {
    if (value == null && unit == null) {
      return null;
    }
    IntervalUnit parsed =
        IntervalUnit.fromString(unit)
            .orElseThrow(() -> new IllegalArgumentException("Unknown interval unit: " + unit));
    return BucketInterval.of(value == null ? 1 : value, parsed);
  }
}
