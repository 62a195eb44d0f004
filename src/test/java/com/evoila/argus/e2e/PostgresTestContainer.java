package com.evoila.argus.e2e;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.utility.DockerImageName;
import org.testcontainers.utility.MountableFile;

/**
 * Helper class to set up the relational database that holds cluster names. The image runs {@code
 * postgres/init.sql} on first start.
 */
public class PostgresTestContainer {

  private static final Logger logger = LoggerFactory.getLogger(PostgresTestContainer.class);

  private static final String POSTGRES_IMAGE = "postgres:16-alpine";
  private static final int PORT = 5432;

  static final String DATABASE = "argus";
  static final String USER = "argus";
  static final String PASSWORD = "argus";

  private GenericContainer<?> postgres;

  public void start() {
    postgres =
        new GenericContainer<>(DockerImageName.parse(POSTGRES_IMAGE))
            .withExposedPorts(PORT)
            .withEnv("POSTGRES_DB", DATABASE)
            .withEnv("POSTGRES_USER", USER)
            .withEnv("POSTGRES_PASSWORD", PASSWORD)
            .withCopyFileToContainer(
                MountableFile.forClasspathResource("postgres/init.sql"),
                "/docker-entrypoint-initdb.d/init.sql")
            // the entrypoint starts a temporary server for init scripts first
            .waitingFor(
                Wait.forLogMessage(".*database system is ready to accept connections.*\\n", 2)
                    .withStartupTimeout(Duration.ofSeconds(60)));
    postgres.start();
    logger.info("PostgreSQL started at {}", getJdbcUrl());
  }

  public void stop() {
    if (postgres != null) {
      postgres.stop();
    }
  }

  public String getJdbcUrl() {
    return String.format(
        "jdbc:postgresql://%s:%d/%s", postgres.getHost(), postgres.getMappedPort(PORT), DATABASE);
  }
}
