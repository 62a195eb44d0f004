package com.evoila.argus.spans;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.argus.base.BaseUnitTest;
import com.evoila.argus.common.query.builder.SelectQueryBuilder;
import com.evoila.argus.common.query.model.BuiltQuery;
import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.Pagination;
import com.evoila.argus.common.query.time.TimeRange;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SpanQueriesTest extends BaseUnitTest {

  private static final String TRACE_ID = "11111111-1111-1111-1111-111111111111";

  private static SpanQuery query(String traceId, List<Filter> filters) {
    return new SpanQuery(
        UUID.fromString(PROJECT_ID),
        traceId == null ? null : UUID.fromString(traceId),
        null,
        List.of(),
        filters,
        TimeRange.unbounded(),
        Pagination.ofPage(0, 100));
  }

  @Test
  void projectListShouldOrderNewestFirst() {
    BuiltQuery built =
        SelectQueryBuilder.build(
            SpanQueries.listOptions(
                query(null, List.of()), List.of(numberFilter("latency", "gt", "2"))));

    assertContainsAll(
        built.query(),
        "toUnixTimestamp64Nano(end_time)",
        "> {latency_0:Float64}",
        "project_id = {project_id:UUID}",
        "ORDER BY start_time DESC, span_id DESC");
    assertThat(built.query()).doesNotContain("trace_id =");
    assertPlaceholdersMatchParameters(built);
  }

  @Test
  void traceScopeShouldCoexistWithTraceIdFilter() {
    List<Filter> filters = List.of(listFilter("trace_id", "has", TRACE_ID, OTHER_ID));
    BuiltQuery built =
        SelectQueryBuilder.build(SpanQueries.listOptions(query(TRACE_ID, filters), filters));

    assertContainsAll(
        built.query(), "trace_id = {trace_id:UUID}", "trace_id IN ({trace_id_0:Array(UUID)})");
    assertThat(built.parameters().get("trace_id").value()).isEqualTo(TRACE_ID);
    assertPlaceholdersMatchParameters(built);
  }

  @Test
  void searchedSpansShouldBePreselected() {
    SpanQuery searched = query(TRACE_ID, List.of()).withSpanIds(List.of(OTHER_ID));
    BuiltQuery built = SelectQueryBuilder.build(SpanQueries.listOptions(searched, List.of()));

    assertContainsAll(
        built.query(), "trace_id = {trace_id:UUID}", "span_id IN ({span_ids:Array(UUID)})");
    assertThat(built.parameters().get("span_ids").value()).isEqualTo(List.of(OTHER_ID));
    assertPlaceholdersMatchParameters(built);
  }
}
