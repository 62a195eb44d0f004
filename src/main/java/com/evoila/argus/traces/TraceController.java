package com.evoila.argus.traces;

import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.model.Pagination;
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
@RequestMapping("/api/v1/projects/{projectId}/traces")
@RequiredArgsConstructor
public class TraceController {

  private final TraceService traceService;
  private final FilterParser filterParser;
  private final RequestParameters requestParameters;

  /**
   * Lists traces of a project.
   *
   * <p>{@code search} finds traces by the text of their spans ({@code searchIn} narrows it to
   * name, input or output); {@code traceId} pre-selects traces found elsewhere. With either, the
   * page holds up to the search cap in search order and {@code pageNumber}/{@code pageSize} are
   * ignored.
   */
  @GetMapping
  public Mono<ListResult<Map<String, Object>>> listTraces(
      @PathVariable("projectId") String projectId,
      @RequestParam(name = "traceType", required = false) String traceType,
      @RequestParam(name = "filter", required = false) List<String> filter,
      @RequestParam(name = "traceId", required = false) List<String> traceIds,
      @RequestParam(name = "search", required = false) String search,
      @RequestParam(name = "searchIn", required = false) List<String> searchIn,
      @RequestParam(name = "pastHours", required = false) String pastHours,
      @RequestParam(name = "startDate", required = false) String startDate,
      @RequestParam(name = "endDate", required = false) String endDate,
      @RequestParam(name = "pageNumber", required = false) Integer pageNumber,
      @RequestParam(name = "pageSize", required = false) Integer pageSize) {
    log.debug("TraceController: Listing traces for project {}", projectId);

    List<String> preselected = RequestParameters.uuids("traceId", traceIds);
    TextSearch textSearch = TextSearch.fromRequest(search, searchIn);
    Pagination pagination =
        preselected.isEmpty() && textSearch == null
            ? requestParameters.pagination(pageNumber, pageSize)
            : requestParameters.preselectionWindow();

    TraceQuery query =
        new TraceQuery(
            RequestParameters.uuid("projectId", projectId),
            TraceType.fromString(traceType),
            preselected,
            textSearch,
            filterParser.parse(filter),
            TimeRange.fromRequest(pastHours, startDate, endDate),
            pagination);
    return traceService.listTraces(query);
  }
}
