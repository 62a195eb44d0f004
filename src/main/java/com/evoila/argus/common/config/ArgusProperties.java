package com.evoila.argus.common.config;

import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Service configuration: the ClickHouse HTTP endpoint, request limits for list queries and the
 * name-lookup cache. The relational store is configured through the standard {@code
 * spring.datasource} keys.
 */
@Data
@Component
@ConfigurationProperties(prefix = "argus")
public class ArgusProperties {

  private ClickHouseConfig clickhouse = new ClickHouseConfig();
  private QueryConfig query = new QueryConfig();
  private NameLookupConfig indirection = new NameLookupConfig();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ClickHouseConfig {
    @Builder.Default private String url = "http://localhost:8123";
    @Builder.Default private String database = "default";
    @Builder.Default private String user = "default";
    @Builder.Default private String password = "";
    @Builder.Default private int bufferSize = 52428800; // 50MB
    @Builder.Default private int maxConnections = 50;
    @Builder.Default private Duration connectTimeout = Duration.ofSeconds(10);
    @Builder.Default private Duration responseTimeout = Duration.ofSeconds(30);
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class QueryConfig {
    @Builder.Default private int defaultPageSize = 50;
    @Builder.Default private int maxPageSize = 500;
    @Builder.Default private int searchMaxHits = 500;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class NameLookupConfig {
    @Builder.Default private CacheConfig cache = new CacheConfig();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CacheConfig {
    @Builder.Default private boolean enabled = true;
    @Builder.Default private long maximumSize = 10_000;
    @Builder.Default private Duration expireAfterWrite = Duration.ofMinutes(10);
  }
}
