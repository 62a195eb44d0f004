package com.evoila.argus.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.evoila.argus.base.BaseUnitTest;
import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.model.BuiltQuery;
import com.evoila.argus.common.query.time.TimeRange;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SpanSearchQueriesTest extends BaseUnitTest {

  private static final UUID TRACE_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

  @Nested
  @DisplayName("Query")
  class Query {

    @Test
    void projectSearchShouldMatchEveryFieldWithOneParameter() {
      BuiltQuery built =
          SelectQueryBuilder.build(
              SpanSearchQueries.options(
                  UUID.fromString(PROJECT_ID),
                  null,
                  TextSearch.fromRequest("50% off", null),
                  TimeRange.pastHours(24),
                  500));

      assertContainsAll(
          built.query(),
          "SELECT trace_id AS traceId, span_id AS spanId FROM spans",
          "project_id = {project_id:UUID}",
          "(name ILIKE concat('%', {search_text:String}, '%')"
              + " OR input ILIKE concat('%', {search_text:String}, '%')"
              + " OR output ILIKE concat('%', {search_text:String}, '%'))",
          "start_time >=",
          "ORDER BY start_time DESC, span_id DESC");
      assertThat(built.query()).doesNotContain("50%").doesNotContain("trace_id =");
      assertThat(built.parameters().get("search_text").value()).isEqualTo("50% off");
      assertThat(built.parameters().get("limit").value()).isEqualTo(500L);
      assertPlaceholdersMatchParameters(built);
    }

    @Test
    void traceSearchShouldIgnoreTimeRange() {
      BuiltQuery built =
          SelectQueryBuilder.build(
              SpanSearchQueries.options(
                  UUID.fromString(PROJECT_ID),
                  TRACE_ID,
                  TextSearch.fromRequest("refund", List.of("output")),
                  TimeRange.pastHours(24),
                  500));

      assertContainsAll(
          built.query(),
          "trace_id = {trace_id:UUID}",
          "(output ILIKE concat('%', {search_text:String}, '%'))");
      assertThat(built.query()).doesNotContain("start_time >=").doesNotContain("name ILIKE");
      assertPlaceholdersMatchParameters(built);
    }
  }

  @Nested
  @DisplayName("Request parsing")
  class Parsing {

    @Test
    void blankSearchShouldMeanNoSearch() {
      assertThat(TextSearch.fromRequest("  ", List.of("name"))).isNull();
      assertThat(TextSearch.fromRequest(null, null)).isNull();
    }

    @Test
    void fieldsShouldBeDistinctAndOrdered() {
      TextSearch search = TextSearch.fromRequest("x", List.of("Output", "name", "OUTPUT", ""));

      assertThat(search.fields()).containsExactly(SearchField.NAME, SearchField.OUTPUT);
    }

    @Test
    void unknownFieldShouldBeRejected() {
      assertThatThrownBy(() -> TextSearch.fromRequest("x", List.of("metadata")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unknown search field: metadata");
    }
  }

  @Test
  void hitsShouldKeepFirstSeenOrderWithoutDuplicates() {
    SearchHits hits =
        SearchHits.fromRows(
            List.of(
                Map.of("traceId", "t2", "spanId", "s3"),
                Map.of("traceId", "t1", "spanId", "s2"),
                Map.of("traceId", "t2", "spanId", "s1")));

    assertThat(hits.traceIds()).containsExactly("t2", "t1");
    assertThat(hits.spanIds()).containsExactly("s3", "s2", "s1");
    assertThat(hits.isEmpty()).isFalse();
  }
}
