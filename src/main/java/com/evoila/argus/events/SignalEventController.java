package com.evoila.argus.events;

import com.evoila.argus.common.query.execution.ListResult;
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
@RequestMapping("/api/v1/projects/{projectId}/signals/{signalId}/events")
@RequiredArgsConstructor
public class SignalEventController {

  private final SignalEventService signalEventService;
  private final FilterParser filterParser;
  private final RequestParameters requestParameters;

  @GetMapping
  public Mono<ListResult<Map<String, Object>>> listEvents(
      @PathVariable("projectId") String projectId,
      @PathVariable("signalId") String signalId,
      @RequestParam(name = "filter", required = false) List<String> filter,
      @RequestParam(name = "pastHours", required = false) String pastHours,
      @RequestParam(name = "startDate", required = false) String startDate,
      @RequestParam(name = "endDate", required = false) String endDate,
      @RequestParam(name = "pageNumber", required = false) Integer pageNumber,
      @RequestParam(name = "pageSize", required = false) Integer pageSize) {
    log.debug("SignalEventController: Listing events of signal {}", signalId);
    return signalEventService.listEvents(
        new SignalEventQuery(
            RequestParameters.uuid("projectId", projectId),
            RequestParameters.uuid("signalId", signalId),
            filterParser.parse(filter),
            TimeRange.fromRequest(pastHours, startDate, endDate),
            requestParameters.pagination(pageNumber, pageSize)));
  }
}
