package com.evoila.argus.traces;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.evoila.argus.base.BaseControllerTest;
import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.execution.QueryExecutionException;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.search.SearchField;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

class TraceControllerTest extends BaseControllerTest {

  private static final String TRACE_ID = "11111111-1111-1111-1111-111111111111";

  @Mock private TraceService traceService;

  private WebTestClient client;

  @BeforeEach
  void setUp() {
    client = bind(new TraceController(traceService, filterParser, requestParameters));
  }

  @Test
  void shouldPassParsedRequestToService() {
    when(traceService.listTraces(any()))
        .thenReturn(Mono.just(ListResult.of(List.of(Map.of("id", TRACE_ID)), 41L)));

    client
        .get()
        .uri(
            "/api/v1/projects/{projectId}/traces?filter={filter}&traceType=evaluation"
                + "&pastHours=6&pageNumber=2&pageSize=20",
            PROJECT_ID,
            "[{\"column\":\"status\",\"operator\":\"eq\",\"value\":\"error\"}]")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.items[0].id")
        .isEqualTo(TRACE_ID)
        .jsonPath("$.totalCount")
        .isEqualTo(41)
        .jsonPath("$.unresolvedFilters")
        .isEmpty();

    ArgumentCaptor<TraceQuery> captor = ArgumentCaptor.forClass(TraceQuery.class);
    verify(traceService).listTraces(captor.capture());
    TraceQuery query = captor.getValue();
    assertThat(query.projectId().toString()).isEqualTo(PROJECT_ID);
    assertThat(query.traceType()).isEqualTo(TraceType.EVALUATION);
    assertThat(query.filters())
        .singleElement()
        .satisfies(f -> assertThat(f.column()).isEqualTo("status"));
    assertThat(query.timeRange().isRelative()).isTrue();
    assertThat(query.pagination()).isEqualTo(new Pagination(20, 40));
    assertThat(query.isPreselected()).isFalse();
  }

  @Test
  void preselectedTracesShouldIgnorePaging() {
    when(traceService.listTraces(any())).thenReturn(Mono.just(ListResult.of(List.of(), 0L)));

    client
        .get()
        .uri(
            "/api/v1/projects/{projectId}/traces?traceId={id}&pageNumber=3",
            PROJECT_ID,
            TRACE_ID)
        .exchange()
        .expectStatus()
        .isOk();

    ArgumentCaptor<TraceQuery> captor = ArgumentCaptor.forClass(TraceQuery.class);
    verify(traceService).listTraces(captor.capture());
    assertThat(captor.getValue().traceIds()).containsExactly(TRACE_ID);
    assertThat(captor.getValue().pagination()).isEqualTo(new Pagination(500, 0));
  }

  @Test
  void searchShouldUsePreselectionWindow() {
    when(traceService.listTraces(any())).thenReturn(Mono.just(ListResult.of(List.of(), 0L)));

    client
        .get()
        .uri(
            "/api/v1/projects/{projectId}/traces?search={search}&searchIn=output&searchIn=NAME"
                + "&pageNumber=2",
            PROJECT_ID,
            " refund ")
        .exchange()
        .expectStatus()
        .isOk();

    ArgumentCaptor<TraceQuery> captor = ArgumentCaptor.forClass(TraceQuery.class);
    verify(traceService).listTraces(captor.capture());
    TraceQuery query = captor.getValue();
    assertThat(query.search().text()).isEqualTo("refund");
    assertThat(query.search().fields()).containsExactly(SearchField.NAME, SearchField.OUTPUT);
    assertThat(query.pagination()).isEqualTo(new Pagination(500, 0));
  }

  @Test
  void unknownSearchFieldShouldBeBadRequest() {
    client
        .get()
        .uri("/api/v1/projects/{projectId}/traces?search=refund&searchIn=metadata", PROJECT_ID)
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.message")
        .isEqualTo("Invalid request parameters: Unknown search field: metadata");

    verifyNoInteractions(traceService);
  }

  @Test
  void invalidProjectIdShouldBeBadRequest() {
    client
        .get()
        .uri("/api/v1/projects/not-a-uuid/traces")
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.errorCode")
        .isEqualTo("INVALID_PARAMS")
        .jsonPath("$.path")
        .isEqualTo("/api/v1/projects/not-a-uuid/traces");

    verifyNoInteractions(traceService);
  }

  @Test
  void negativePageShouldBeBadRequest() {
    client
        .get()
        .uri("/api/v1/projects/{projectId}/traces?pageNumber=-1", PROJECT_ID)
        .exchange()
        .expectStatus()
        .isBadRequest();

    verifyNoInteractions(traceService);
  }

  @Test
  void unparseableStartDateShouldBeBadRequest() {
    client
        .get()
        .uri("/api/v1/projects/{projectId}/traces?pastHours=6&startDate=yesterday", PROJECT_ID)
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.message")
        .isEqualTo("Invalid request parameters: startDate is not a valid date: yesterday");

    verifyNoInteractions(traceService);
  }

  @Test
  void unavailableBackendShouldBeServiceUnavailable() {
    when(traceService.listTraces(any()))
        .thenReturn(Mono.error(QueryExecutionException.retryable("connection refused", null)));

    client
        .get()
        .uri("/api/v1/projects/{projectId}/traces", PROJECT_ID)
        .exchange()
        .expectStatus()
        .isEqualTo(503)
        .expectBody()
        .jsonPath("$.errorCode")
        .isEqualTo("BACKEND_UNAVAILABLE");
  }
}
