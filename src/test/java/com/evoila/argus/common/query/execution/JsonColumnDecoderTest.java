package com.evoila.argus.common.query.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.argus.base.BaseUnitTest;
import com.evoila.argus.common.config.JacksonConfig;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JsonColumnDecoderTest extends BaseUnitTest {

  private final JsonColumnDecoder decoder = new JsonColumnDecoder(new JacksonConfig().jsonMapper());

  @Test
  void shouldParseObjectsAndArrays() {
    Map<String, Object> decoded =
        decoder.decode(
            Map.of("scores", "{\"accuracy\":0.75}", "tags", "[\"a\",\"b\"]"),
            Set.of("scores", "tags"));

    assertThat(decoded.get("scores")).isEqualTo(Map.of("accuracy", new BigDecimal("0.75")));
    assertThat(decoded.get("tags")).isEqualTo(List.of("a", "b"));
  }

  @Test
  void invalidOrBlankTextShouldBeKept() {
    Map<String, Object> decoded =
        decoder.decode(Map.of("metadata", "{broken", "scores", " "), Set.of("metadata", "scores"));

    assertThat(decoded).containsEntry("metadata", "{broken").containsEntry("scores", " ");
  }

  @Test
  void nullAndMissingColumnsShouldBeIgnored() {
    Map<String, Object> row = new HashMap<>();
    row.put("metadata", null);

    Map<String, Object> decoded = decoder.decode(row, Set.of("metadata", "scores"));

    assertThat(decoded).containsEntry("metadata", null).doesNotContainKey("scores");
  }

  @Test
  void rowWithoutJsonColumnsShouldBeReturnedAsIs() {
    Map<String, Object> row = Map.of("id", "a");

    assertThat(decoder.decode(row, Set.of())).isSameAs(row);
  }
}
