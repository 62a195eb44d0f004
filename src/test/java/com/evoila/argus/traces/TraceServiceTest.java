package com.evoila.argus.traces;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.evoila.argus.base.BaseUnitTest;
import com.evoila.argus.common.indirection.ClusterNameLookup;
import com.evoila.argus.common.indirection.FilterIndirectionResolver;
import com.evoila.argus.common.query.execution.ListResult;
import com.evoila.argus.common.query.execution.QueryExecutor;
import com.evoila.argus.common.query.model.BuiltQuery;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.time.TimeRange;
import com.evoila.argus.search.SearchHits;
import com.evoila.argus.search.SpanSearchService;
import com.evoila.argus.search.TextSearch;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class TraceServiceTest extends BaseUnitTest {

  private static final String TRACE_A = "11111111-1111-1111-1111-111111111111";
  private static final String TRACE_B = "22222222-2222-2222-2222-222222222222";

  @Mock private ClusterNameLookup clusterNameLookup;
  @Mock private QueryExecutor queryExecutor;
  @Mock private SpanSearchService spanSearchService;

  private TraceService traceService;

  @BeforeEach
  void setUp() {
    traceService =
        new TraceService(
            new FilterIndirectionResolver(clusterNameLookup), queryExecutor, spanSearchService);
  }

  private static TraceQuery query(List<String> traceIds, List<Filter> filters) {
    return query(traceIds, null, filters);
  }

  private static TraceQuery query(List<String> traceIds, TextSearch search, List<Filter> filters) {
    return new TraceQuery(
        UUID.fromString(PROJECT_ID),
        TraceType.DEFAULT,
        traceIds,
        search,
        filters,
        TimeRange.pastHours(24),
        Pagination.ofPage(0, 50));
  }

  @Nested
  @DisplayName("Pattern names")
  class PatternNames {

    @Test
    void unknownPatternShouldShortCircuitWithoutQuerying() {
      when(clusterNameLookup.findClusterId(any(), eq("checkout errors"))).thenReturn(Mono.empty());

      StepVerifier.create(
              traceService.listTraces(
                  query(List.of(), List.of(filter("pattern", "eq", "checkout errors")))))
          .assertNext(
              result -> {
                assertThat(result.items()).isEmpty();
                assertThat(result.totalCount()).isZero();
                assertThat(result.unresolvedFilters()).containsExactly("checkout errors");
              })
          .verifyComplete();

      verifyNoInteractions(queryExecutor);
    }

    @Test
    void knownPatternShouldFilterOnClusterId() {
      when(clusterNameLookup.findClusterId(any(), eq("checkout errors")))
          .thenReturn(Mono.just(OTHER_ID));
      when(queryExecutor.fetchPage(any(), any(), eq(TraceQueries.JSON_COLUMNS)))
          .thenReturn(Mono.just(ListResult.of(List.of(), 0L)));

      StepVerifier.create(
              traceService.listTraces(
                  query(List.of(), List.of(filter("pattern", "eq", "checkout errors")))))
          .expectNextCount(1)
          .verifyComplete();

      ArgumentCaptor<BuiltQuery> rows = ArgumentCaptor.forClass(BuiltQuery.class);
      ArgumentCaptor<BuiltQuery> count = ArgumentCaptor.forClass(BuiltQuery.class);
      verify(queryExecutor)
          .fetchPage(rows.capture(), count.capture(), eq(TraceQueries.JSON_COLUMNS));
      assertThat(rows.getValue().query()).contains("cluster_ids").doesNotContain("checkout");
      assertThat(rows.getValue().parameters().values()).containsValue(OTHER_ID);
      assertThat(count.getValue().query()).startsWith("SELECT count() AS total_count FROM traces");
      assertPlaceholdersMatchParameters(rows.getValue());
    }

    @Test
    void unknownExcludedPatternShouldOnlyBeReported() {
      when(clusterNameLookup.findClusterId(any(), eq("noise"))).thenReturn(Mono.empty());
      when(queryExecutor.fetchPage(any(), any(), any()))
          .thenReturn(Mono.just(ListResult.of(List.of(Map.of("id", TRACE_A)), 1L)));

      StepVerifier.create(
              traceService.listTraces(query(List.of(), List.of(filter("pattern", "ne", "noise")))))
          .assertNext(
              result -> {
                assertThat(result.items()).hasSize(1);
                assertThat(result.unresolvedFilters()).containsExactly("noise");
              })
          .verifyComplete();
    }
  }

  @Nested
  @DisplayName("Search pre-selection")
  class Preselection {

    @Test
    void rowsShouldKeepSearchRank() {
      when(queryExecutor.fetchPage(any(), any(), any()))
          .thenReturn(
              Mono.just(
                  ListResult.of(List.of(Map.of("id", TRACE_A), Map.of("id", TRACE_B)), 2L)));

      StepVerifier.create(traceService.listTraces(query(List.of(TRACE_B, TRACE_A), List.of())))
          .assertNext(
              result ->
                  assertThat(result.items())
                      .extracting(row -> row.get("id"))
                      .containsExactly(TRACE_B, TRACE_A))
          .verifyComplete();

      ArgumentCaptor<BuiltQuery> rows = ArgumentCaptor.forClass(BuiltQuery.class);
      verify(queryExecutor).fetchPage(rows.capture(), any(), any());
      assertThat(rows.getValue().parameters().get("trace_ids").value())
          .isEqualTo(List.of(TRACE_B, TRACE_A));
      verifyNoInteractions(clusterNameLookup);
    }
  }

  @Nested
  @DisplayName("Text search")
  class Search {

    private final TextSearch refund = TextSearch.fromRequest("refund", null);

    @Test
    void searchHitsShouldSelectTracesInHitOrder() {
      when(spanSearchService.search(eq(UUID.fromString(PROJECT_ID)), isNull(), eq(refund), any()))
          .thenReturn(
              Mono.just(new SearchHits(List.of(TRACE_B, TRACE_A), List.of("s1", "s2", "s3"))));
      when(queryExecutor.fetchPage(any(), any(), any()))
          .thenReturn(
              Mono.just(
                  ListResult.of(List.of(Map.of("id", TRACE_A), Map.of("id", TRACE_B)), 2L)));

      StepVerifier.create(traceService.listTraces(query(List.of(), refund, List.of())))
          .assertNext(
              result ->
                  assertThat(result.items())
                      .extracting(row -> row.get("id"))
                      .containsExactly(TRACE_B, TRACE_A))
          .verifyComplete();

      ArgumentCaptor<BuiltQuery> rows = ArgumentCaptor.forClass(BuiltQuery.class);
      verify(queryExecutor).fetchPage(rows.capture(), any(), any());
      assertThat(rows.getValue().query()).contains("id IN ({trace_ids:Array(UUID)})");
      assertThat(rows.getValue().parameters().get("trace_ids").value())
          .isEqualTo(List.of(TRACE_B, TRACE_A));
    }

    @Test
    void noHitsShouldReturnEmptyPageWithoutListing() {
      when(spanSearchService.search(any(), any(), any(), any()))
          .thenReturn(Mono.just(new SearchHits(List.of(), List.of())));

      StepVerifier.create(traceService.listTraces(query(List.of(), refund, List.of())))
          .assertNext(
              result -> {
                assertThat(result.items()).isEmpty();
                assertThat(result.totalCount()).isZero();
              })
          .verifyComplete();

      verifyNoInteractions(queryExecutor, clusterNameLookup);
    }

    @Test
    void explicitTraceIdsShouldNarrowHits() {
      when(spanSearchService.search(any(), any(), any(), any()))
          .thenReturn(Mono.just(new SearchHits(List.of(TRACE_B, TRACE_A), List.of("s1", "s2"))));
      when(queryExecutor.fetchPage(any(), any(), any()))
          .thenReturn(Mono.just(ListResult.of(List.of(Map.of("id", TRACE_A)), 1L)));

      StepVerifier.create(traceService.listTraces(query(List.of(TRACE_A), refund, List.of())))
          .expectNextCount(1)
          .verifyComplete();

      ArgumentCaptor<BuiltQuery> rows = ArgumentCaptor.forClass(BuiltQuery.class);
      verify(queryExecutor).fetchPage(rows.capture(), any(), any());
      assertThat(rows.getValue().parameters().get("trace_ids").value())
          .isEqualTo(List.of(TRACE_A));
    }

    @Test
    void hitsOutsideExplicitTraceIdsShouldGiveEmptyPage() {
      when(spanSearchService.search(any(), any(), any(), any()))
          .thenReturn(Mono.just(new SearchHits(List.of(TRACE_B), List.of("s1"))));

      StepVerifier.create(traceService.listTraces(query(List.of(TRACE_A), refund, List.of())))
          .assertNext(result -> assertThat(result.items()).isEmpty())
          .verifyComplete();

      verifyNoInteractions(queryExecutor);
    }
  }
}
