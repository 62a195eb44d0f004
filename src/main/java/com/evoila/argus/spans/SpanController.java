package com.evoila.argus.spans;

import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.time.TimeRange;
import com.evoila.argus.common.request.FilterParser;
import com.evoila.argus.common.request.RequestParameters;
import com.evoila.argus.search.TextSearch;
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
@RequestMapping("/api/v1/projects/{projectId}")
@RequiredArgsConstructor
public class SpanController {

  private final SpanService spanService;
  private final FilterParser filterParser;
  private final RequestParameters requestParameters;

  @GetMapping("/spans")
  public Mono<ListResult<Map<String, Object>>> listSpans(
      @PathVariable("projectId") String projectId,
      @RequestParam(name = "filter", required = false) List<String> filter,
      @RequestParam(name = "search", required = false) String search,
      @RequestParam(name = "searchIn", required = false) List<String> searchIn,
      @RequestParam(name = "pastHours", required = false) String pastHours,
      @RequestParam(name = "startDate", required = false) String startDate,
      @RequestParam(name = "endDate", required = false) String endDate,
      @RequestParam(name = "pageNumber", required = false) Integer pageNumber,
      @RequestParam(name = "pageSize", required = false) Integer pageSize) {
    log.debug("SpanController: Listing spans for project {}", projectId);
    return spanService.listSpans(
        new SpanQuery(
            RequestParameters.uuid("projectId", projectId),
            null,
            TextSearch.fromRequest(search, searchIn),
            List.of(),
            filterParser.parse(filter),
            TimeRange.fromRequest(pastHours, startDate, endDate),
            requestParameters.pagination(pageNumber, pageSize)));
  }

  /** Spans of one trace; the trace bounds them, so no time range applies. */
  @GetMapping("/traces/{traceId}/spans")
  public Mono<ListResult<Map<String, Object>>> listTraceSpans(
      @PathVariable("projectId") String projectId,
      @PathVariable("traceId") String traceId,
      @RequestParam(name = "filter", required = false) List<String> filter,
      @RequestParam(name = "search", required = false) String search,
      @RequestParam(name = "searchIn", required = false) List<String> searchIn,
      @RequestParam(name = "pageNumber", required = false) Integer pageNumber,
      @RequestParam(name = "pageSize", required = false) Integer pageSize) {
    log.debug("SpanController: Listing spans of trace {}", traceId);
    return spanService.listSpans(
        new SpanQuery(
            RequestParameters.uuid("projectId", projectId),
            RequestParameters.uuid("traceId", traceId),
            TextSearch.fromRequest(search, searchIn),
            List.of(),
            filterParser.parse(filter),
            TimeRange.unbounded(),
            requestParameters.pagination(pageNumber, pageSize)));
  }
}
