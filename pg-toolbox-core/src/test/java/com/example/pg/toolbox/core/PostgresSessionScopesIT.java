package com.example.pg.toolbox.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.pg.toolbox.core.cloud.CloudEnvironment;
import com.example.pg.toolbox.core.errors.AlreadyExistsException;
import com.example.pg.toolbox.core.errors.LockUnavailableException;
import com.example.pg.toolbox.core.errors.RoleException;
import com.example.pg.toolbox.core.jdbc.AdvisoryLocks;
import com.example.pg.toolbox.core.jdbc.CloudEnvironments;
import com.example.pg.toolbox.core.jdbc.DatabaseObjects;
import com.example.pg.toolbox.core.jdbc.SessionScopes;
import com.example.pg.toolbox.core.locks.AdvisoryLockKey;
import com.example.pg.toolbox.core.locks.LockMode;
import com.example.pg.toolbox.core.reactive.R2dbcAdvisoryLocks;
import com.example.pg.toolbox.core.reactive.R2dbcCloudEnvironments;
import com.example.pg.toolbox.core.reactive.R2dbcDatabaseObjects;
import com.example.pg.toolbox.core.reactive.R2dbcSessionScopes;
import io.r2dbc.postgresql.PostgresqlConnectionConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionFactory;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;
import reactor.core.publisher.Mono;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
class PostgresSessionScopesIT {

  private PostgreSQLContainer<?> postgres;
  private PostgresqlConnectionFactory r2dbc;

  @BeforeAll
  void setup() throws SQLException {
    assumeTrue(dockerAvailable(), "Docker not available, skipping integration test");

    postgres =
        new PostgreSQLContainer<>(DockerImageName.parse("postgres:17"))
            .withDatabaseName("testdb")
            .withUsername("testuser")
            .withPassword("testpass");
    postgres.start();

    r2dbc =
        new PostgresqlConnectionFactory(
            PostgresqlConnectionConfiguration.builder()
                .host(postgres.getHost())
                .port(postgres.getFirstMappedPort())
                .database(postgres.getDatabaseName())
                .username(postgres.getUsername())
                .password(postgres.getPassword())
                .build());

    try (final var conn = jdbc()) {
      DatabaseObjects.createRole(conn, "reporting_it", null, false, true);
    }
  }

  @AfterAll
  void cleanup() {
    if (postgres != null) postgres.stop();
  }

  @Nested
  @DisplayName("JDBC")
  class Jdbc {

    @Test
    @DisplayName("Should switch role for the scope and restore the session user")
    void shouldSwitchRole() throws SQLException {
      try (final var conn = jdbc()) {
        final var inside =
            SessionScopes.withRole(conn, "reporting_it", DatabaseObjects::currentRole);

        assertEquals("reporting_it", inside);
        assertEquals(postgres.getUsername(), DatabaseObjects.currentRole(conn));
      }
    }

    @Test
    @DisplayName("An unknown role raises RoleException and leaves the session untouched")
    void shouldRejectUnknownRole() throws SQLException {
      try (final var conn = jdbc()) {
        final var error =
            assertThrows(
                RoleException.class,
                () -> SessionScopes.withRole(conn, "no_such_role_it", c -> 1));

        assertEquals("22023", error.sqlState());
        assertEquals(postgres.getUsername(), DatabaseObjects.currentRole(conn));
      }
    }

    @Test
    @DisplayName("A held lock is unavailable to other sessions until released")
    void shouldContendForLock() throws SQLException {
      final var key = AdvisoryLockKey.forName("it:jdbc-contention");
      try (final var first = jdbc();
          final var second = jdbc()) {
        try (final var held = AdvisoryLocks.acquire(first, key, LockMode.NON_BLOCKING)) {
          assertThrows(
              LockUnavailableException.class,
              () -> AdvisoryLocks.tryWithLock(second, key, c -> "never"));
        }

        assertEquals("acquired", AdvisoryLocks.tryWithLock(second, key, c -> "acquired"));
      }
    }

    @Test
    @DisplayName("Blocking acquire decodes the void result of pg_advisory_lock")
    void shouldAcquireBlocking() throws SQLException {
      try (final var conn = jdbc()) {
        final var result =
            AdvisoryLocks.withLock(
                conn, AdvisoryLockKey.of(7, 11), LockMode.BLOCKING, c -> "locked");
        assertEquals("locked", result);
      }
    }

    @Test
    @DisplayName("Should create and drop a database from inside a transaction-mode connection")
    void shouldManageDatabase() throws SQLException {
      try (final var conn = jdbc()) {
        conn.setAutoCommit(false);

        assertTrue(DatabaseObjects.createDatabase(conn, "scratch_jdbc", false));
        assertFalse(conn.getAutoCommit());
        assertTrue(DatabaseObjects.databaseExists(conn, "scratch_jdbc"));
        assertThrows(
            AlreadyExistsException.class,
            () -> DatabaseObjects.createDatabase(conn, "scratch_jdbc", false));
        assertTrue(DatabaseObjects.dropDatabase(conn, "scratch_jdbc", false));
        assertFalse(DatabaseObjects.dropDatabase(conn, "scratch_jdbc", true));
        conn.rollback();
      }
    }

    @Test
    @DisplayName("A plain container is not a managed cloud offering")
    void shouldDetectSelfHosted() throws SQLException {
      try (final var conn = jdbc()) {
        assertEquals(CloudEnvironment.NONE, CloudEnvironments.detect(conn));
      }
    }
  }

  @Nested
  @DisplayName("R2DBC")
  class R2dbc {

    @Test
    @DisplayName("Should switch role for the scope and restore the session user")
    void shouldSwitchRole() {
      final var roles =
          withConnection(
              conn ->
                  R2dbcSessionScopes.withRole(
                          conn, "reporting_it", R2dbcDatabaseObjects::currentRole)
                      .flatMap(
                          inside ->
                              R2dbcDatabaseObjects.currentRole(conn)
                                  .map(after -> inside + "," + after)));

      assertEquals("reporting_it," + postgres.getUsername(), roles);
    }

    @Test
    @DisplayName("A blocking acquire waits for the JDBC holder to release")
    void shouldWaitForJdbcHolder() throws Exception {
      final var key = AdvisoryLockKey.forName("it:r2dbc-wait");
      try (final var holder = jdbc()) {
        final var held = AdvisoryLocks.acquire(holder, key, LockMode.BLOCKING);
        final var waiting =
            withConnectionAsync(
                conn ->
                    R2dbcAdvisoryLocks.withLock(conn, key, LockMode.BLOCKING, c -> Mono.just(1)));

        Thread.sleep(500);
        assertFalse(waiting.isDone());

        held.close();
        assertEquals(1, waiting.get(10, TimeUnit.SECONDS));
      }
    }

    @Test
    @DisplayName("Should toggle autocommit around database creation")
    void shouldManageDatabase() {
      final var dropped =
          withConnection(
              conn ->
                  Mono.from(conn.setAutoCommit(false))
                      .then(R2dbcDatabaseObjects.createDatabase(conn, "scratch_r2dbc", false))
                      .filter(created -> created && !conn.isAutoCommit())
                      .flatMap(
                          created ->
                              R2dbcDatabaseObjects.dropDatabase(conn, "scratch_r2dbc", false)));

      assertEquals(Boolean.TRUE, dropped);
    }

    @Test
    @DisplayName("A plain container is not a managed cloud offering")
    void shouldDetectSelfHosted() {
      assertEquals(CloudEnvironment.NONE, withConnection(R2dbcCloudEnvironments::detect));
    }
  }

  private Connection jdbc() throws SQLException {
    return DriverManager.getConnection(
        postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
  }

  private <T> Mono<T> usingConnection(final Function<io.r2dbc.spi.Connection, Mono<T>> work) {
    return Mono.usingWhen(Mono.from(r2dbc.create()), work, conn -> Mono.from(conn.close()));
  }

  private <T> T withConnection(final Function<io.r2dbc.spi.Connection, Mono<T>> work) {
    return usingConnection(work).block();
  }

  private <T> CompletableFuture<T> withConnectionAsync(
      final Function<io.r2dbc.spi.Connection, Mono<T>> work) {
    return usingConnection(work).toFuture();
  }

  private static boolean dockerAvailable() {
    try {
      org.testcontainers.DockerClientFactory.instance().client();
      return true;
    } catch (Throwable t) {
      return false;
    }
  }
}
