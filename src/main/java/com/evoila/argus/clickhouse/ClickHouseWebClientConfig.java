package com.evoila.argus.clickhouse;

import com.evoila.argus.common.config.ArgusProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

@Configuration
@Slf4j
public class ClickHouseWebClientConfig {

  @Bean
  public WebClient clickHouseWebClient(ArgusProperties properties) {
    ArgusProperties.ClickHouseConfig config = properties.getClickhouse();
    log.info("Creating ClickHouse WebClient for {}", config.getUrl());

    ConnectionProvider connectionProvider =
        ConnectionProvider.builder("clickhouse-pool")
            .maxConnections(config.getMaxConnections())
            .maxIdleTime(Duration.ofSeconds(30))
            .maxLifeTime(Duration.ofMinutes(5))
            .pendingAcquireTimeout(Duration.ofSeconds(10))
            .evictInBackground(Duration.ofSeconds(30))
            .build();

    return WebClient.builder()
        .baseUrl(config.getUrl())
        .clientConnector(
            new ReactorClientHttpConnector(createHttpClient(connectionProvider, config)))
        .codecs(
            configurer -> {
              // Large result pages arrive as a single body
              configurer.defaultCodecs().maxInMemorySize(config.getBufferSize());
              log.info(
                  "ClickHouse WebClient buffer size: {} bytes ({} MB)",
                  config.getBufferSize(),
                  config.getBufferSize() / (1024 * 1024));
            })
        .build();
  }

  private HttpClient createHttpClient(
      ConnectionProvider connectionProvider, ArgusProperties.ClickHouseConfig config) {
    long responseSeconds = config.getResponseTimeout().toSeconds();
    return HttpClient.create(connectionProvider)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
        .responseTimeout(config.getResponseTimeout())
        .doOnConnected(
            conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseSeconds, TimeUnit.SECONDS))
                    .addHandlerLast(new WriteTimeoutHandler(10, TimeUnit.SECONDS)))
        .doOnRequest(
            (request, connection) ->
                log.debug("ClickHouse request: {} {}", request.method(), request.uri()))
        .doOnResponse(
            (response, connection) ->
                log.debug("ClickHouse response: {} from {}", response.status(), response.uri()));
  }
}
