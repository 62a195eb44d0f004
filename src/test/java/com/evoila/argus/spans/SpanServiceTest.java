package com.evoila.argus.spans;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.evoila.argus.base.BaseUnitTest;
import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.execution.QueryExecutor;
import com.evoila.argus.common.query.model.BuiltQuery;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.time.TimeRange;
import com.evoila.argus.search.SearchHits;
import com.evoila.argus.search.SpanSearchService;
import com.evoila.argus.search.TextSearch;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class SpanServiceTest extends BaseUnitTest {

  private static final UUID TRACE_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
  private static final String SPAN_A = "a1111111-1111-1111-1111-111111111111";
  private static final String SPAN_B = "a2222222-2222-2222-2222-222222222222";

  @Mock private QueryExecutor queryExecutor;
  @Mock private SpanSearchService spanSearchService;

  private SpanService spanService;

  @BeforeEach
  void setUp() {
    spanService = new SpanService(queryExecutor, spanSearchService);
  }

  private static SpanQuery query(UUID traceId, TextSearch search) {
    return new SpanQuery(
        UUID.fromString(PROJECT_ID),
        traceId,
        search,
        List.of(),
        List.of(),
        TimeRange.unbounded(),
        Pagination.ofPage(1, 10));
  }

  @Test
  void withoutSearchShouldListDirectly() {
    when(queryExecutor.fetchPage(any(), any(), eq(SpanQueries.JSON_COLUMNS)))
        .thenReturn(Mono.just(ListResult.of(List.of(Map.of("spanId", SPAN_A)), 11L)));

    StepVerifier.create(spanService.listSpans(query(null, null)))
        .assertNext(result -> assertThat(result.totalCount()).isEqualTo(11L))
        .verifyComplete();

    verifyNoInteractions(spanSearchService);
  }

  @Test
  void searchHitsShouldBePagedLikeAnyList() {
    TextSearch search = TextSearch.fromRequest("refund", List.of("output"));
    when(spanSearchService.search(
            eq(UUID.fromString(PROJECT_ID)), eq(TRACE_ID), eq(search), any()))
        .thenReturn(
            Mono.just(new SearchHits(List.of(TRACE_ID.toString()), List.of(SPAN_B, SPAN_A))));
    when(queryExecutor.fetchPage(any(), any(), any()))
        .thenReturn(Mono.just(ListResult.of(List.of(), 2L)));

    StepVerifier.create(spanService.listSpans(query(TRACE_ID, search)))
        .expectNextCount(1)
        .verifyComplete();

    ArgumentCaptor<BuiltQuery> rows = ArgumentCaptor.forClass(BuiltQuery.class);
    ArgumentCaptor<BuiltQuery> count = ArgumentCaptor.forClass(BuiltQuery.class);
    verify(queryExecutor).fetchPage(rows.capture(), count.capture(), any());
    assertContainsAll(
        rows.getValue().query(),
        "span_id IN ({span_ids:Array(UUID)})",
        "LIMIT {limit:UInt32} OFFSET {offset:UInt32}");
    assertThat(rows.getValue().parameters().get("span_ids").value())
        .isEqualTo(List.of(SPAN_B, SPAN_A));
    assertThat(count.getValue().query()).contains("span_id IN ({span_ids:Array(UUID)})");
    assertPlaceholdersMatchParameters(rows.getValue());
  }

  @Test
  void noHitsShouldGiveEmptyPageWithoutListing() {
    when(spanSearchService.search(any(), any(), any(), any()))
        .thenReturn(Mono.just(new SearchHits(List.of(), List.of())));

    StepVerifier.create(spanService.listSpans(query(null, TextSearch.fromRequest("zzz", null))))
        .assertNext(
            result -> {
              assertThat(result.items()).isEmpty();
              assertThat(result.totalCount()).isZero();
            })
        .verifyComplete();

    verifyNoInteractions(queryExecutor);
  }
}
