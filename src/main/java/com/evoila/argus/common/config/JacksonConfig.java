package com.evoila.argus.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.json.JsonMapper;

@Configuration
public class JacksonConfig {

  /**
   * Mapper for request filters, ClickHouse rows and error bodies. Floating point numbers decode as
   * {@code BigDecimal} so filter values keep their exact text.
   */
  @Bean
  public JsonMapper jsonMapper() {
    return JsonMapper.builder()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }
}
