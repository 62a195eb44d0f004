package com.evoila.argus.base;

import com.evoila.argus.common.config.ArgusProperties;
import com.evoila.argus.common.config.JacksonConfig;
import com.evoila.argus.common.request.FilterParser;
import com.evoila.argus.common.request.RequestParameters;
import com.evoila.argus.common.web.GlobalExceptionHandler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.springframework.test.web.reactive.server.MockServerConfigurer;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.server.adapter.WebHttpHandlerBuilder;
import tools.jackson.databind.json.JsonMapper;

/**
 * Base class for controller tests. Binds a single controller without a server, with the real
 * request parsing and error handling in front of it.
 */
public abstract class BaseControllerTest extends BaseUnitTest {

  protected static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

  protected final JsonMapper jsonMapper = new JacksonConfig().jsonMapper();
  protected final FilterParser filterParser = new FilterParser(jsonMapper);
  protected final RequestParameters requestParameters =
      new RequestParameters(new ArgusProperties());

  protected WebTestClient bind(Object controller) {
    GlobalExceptionHandler exceptionHandler = new GlobalExceptionHandler(jsonMapper, CLOCK);
    return WebTestClient.bindToController(controller)
        .apply(
            new MockServerConfigurer() {
              @Override
              public void beforeServerCreated(WebHttpHandlerBuilder builder) {
                builder.exceptionHandler(exceptionHandler);
              }
            })
        .build();
  }
}
