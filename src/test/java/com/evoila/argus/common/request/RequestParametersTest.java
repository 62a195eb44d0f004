package com.evoila.argus.common.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.evoila.argus.base.BaseUnitTest;
import com.evoila.argus.common.config.ArgusProperties;
import com.evoila.argus.common.query.model.Pagination;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequestParametersTest extends BaseUnitTest {

  private RequestParameters parameters;

  @BeforeEach
  void setUp() {
    ArgusProperties properties = new ArgusProperties();
    properties.getQuery().setDefaultPageSize(50);
    properties.getQuery().setMaxPageSize(100);
    properties.getQuery().setSearchMaxHits(200);
    parameters = new RequestParameters(properties);
  }

  @Test
  void paginationShouldApplyDefaultsAndCap() {
    assertEquals(new Pagination(50, 0), parameters.pagination(null, null));
    assertEquals(new Pagination(20, 40), parameters.pagination(2, 20));
    assertEquals(new Pagination(100, 300), parameters.pagination(3, 1000));
  }

  @Test
  void invalidPaginationShouldBeRejected() {
    assertThrows(IllegalArgumentException.class, () -> parameters.pagination(-1, 10));
    assertThrows(IllegalArgumentException.class, () -> parameters.pagination(0, 0));
  }

  @Test
  void offsetBeyondUInt32ShouldBeRejected() {
    assertEquals(
        new Pagination(100, 4_294_967_200L), parameters.pagination(42_949_672, 100));
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> parameters.pagination(42_949_673, 100));
    assertThat(e.getMessage()).isEqualTo("pageNumber is too large: 42949673");
  }

  @Test
  void preselectionWindowShouldUseSearchCap() {
    assertEquals(new Pagination(200, 0), parameters.preselectionWindow());
  }

  @Test
  void uuidsShouldBeValidatedAndDeduplicated() {
    String id = PROJECT_ID.toString();

    assertThat(RequestParameters.uuids("traceId", Arrays.asList(id, " ", null, id.toUpperCase())))
        .containsExactly(id);
    assertThat(RequestParameters.uuids("traceId", null)).isEmpty();
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> RequestParameters.uuids("traceId", List.of("nope")));
    assertThat(e.getMessage()).contains("traceId");
    assertThrows(IllegalArgumentException.class, () -> RequestParameters.uuid("projectId", ""));
  }
}
