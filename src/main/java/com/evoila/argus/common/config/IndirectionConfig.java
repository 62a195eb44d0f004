package com.evoila.argus.common.config;

import com.evoila.argus.common.indirection.CachingClusterNameLookup;
import com.evoila.argus.common.indirection.ClusterNameLookup;
import com.evoila.argus.common.indirection.JdbcClusterNameLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Slf4j
@Configuration
public class IndirectionConfig {

  @Bean
  public ClusterNameLookup clusterNameLookup(
      NamedParameterJdbcTemplate jdbcTemplate, ArgusProperties properties) {
    ClusterNameLookup lookup = new JdbcClusterNameLookup(jdbcTemplate);
    ArgusProperties.CacheConfig cache = properties.getIndirection().getCache();
    if (cache.isEnabled()) {
      log.info(
          "Cluster name lookups cached (max {} entries, expiry {})",
          cache.getMaximumSize(),
          cache.getExpireAfterWrite());
      return new CachingClusterNameLookup(
          lookup, cache.getMaximumSize(), cache.getExpireAfterWrite());
    }
    log.info("Cluster name lookup cache disabled");
    return lookup;
  }
}
