package com.example.pg.toolbox.core.reactive;

import static org.junit.jupiter.api.Assertions.*;

import com.example.pg.toolbox.core.ToolboxSettings;
import com.example.pg.toolbox.core.errors.LockUnavailableException;
import com.example.pg.toolbox.core.errors.RestorationFailedException;
import com.example.pg.toolbox.core.locks.AdvisoryLockKey;
import com.example.pg.toolbox.core.locks.LockMode;
import com.example.pg.toolbox.core.testing.FakePostgres;
import com.example.pg.toolbox.core.testing.FakeR2dbc;
import com.example.pg.toolbox.core.testing.LogCapture;
import io.r2dbc.spi.Connection;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import org.junit.jupiter.api.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class R2dbcAdvisoryLocksTest {

  private static final AdvisoryLockKey KEY = AdvisoryLockKey.forName("billing:nightly-export");

  private FakePostgres server;
  private FakePostgres.Session first;
  private FakePostgres.Session second;
  private Connection secondConn;

  @BeforeEach
  void setUp() {
    server = new FakePostgres().withRole("app");
    first = server.connect("app");
    second = server.connect("app");
    secondConn = FakeR2dbc.connect(second);
  }

  @AfterEach
  void tearDown() {
    System.clearProperty(ToolboxSettings.LOCK_MODE_PROPERTY);
  }

  private void holdInFirstSession(final AdvisoryLockKey key) {
    first.submit(key.call("pg_advisory_lock", i -> "?"), key.arguments()).join();
  }

  private void releaseInFirstSession(final AdvisoryLockKey key) {
    first.submit(key.call("pg_advisory_unlock", i -> "?"), key.arguments()).join();
  }

  @Test
  @DisplayName("Should hold the lock while the body runs and release it afterwards")
  void shouldAcquireAndRelease() {
    final var heldInside =
        R2dbcAdvisoryLocks.withLock(
                secondConn, KEY, LockMode.NON_BLOCKING, c -> Mono.fromSupplier(second::locksHeld))
            .block();

    assertEquals(1, heldInside);
    assertEquals(0, second.locksHeld());
    assertEquals(
        List.of("SELECT pg_try_advisory_lock(?)", "SELECT pg_advisory_unlock(?)"),
        second.events());
  }

  @Test
  @DisplayName("Non-blocking acquire fails fast when another session holds the lock")
  void shouldFailFastWhenHeld() {
    holdInFirstSession(KEY);

    final var error =
        assertThrows(
            LockUnavailableException.class,
            () ->
                R2dbcAdvisoryLocks.withLock(
                        secondConn, KEY, LockMode.NON_BLOCKING, c -> Mono.just("ran"))
                    .block());

    assertEquals(KEY, error.key());
    assertEquals(List.of("SELECT pg_try_advisory_lock(?)"), second.events());
  }

  @Test
  @DisplayName("Blocking acquire completes once the holder releases")
  void shouldWaitForRelease() throws Exception {
    holdInFirstSession(KEY);

    final var result =
        R2dbcAdvisoryLocks.withLock(secondConn, KEY, LockMode.BLOCKING, c -> Mono.just("ran"))
            .toFuture();

    assertFalse(result.isDone());
    assertEquals(1, server.waitingAcquirers());

    releaseInFirstSession(KEY);

    assertEquals("ran", result.get(5, TimeUnit.SECONDS));
    assertEquals(0, second.locksHeld());
  }

  @Test
  @DisplayName("A lock granted after cancellation is released straight away")
  void shouldReleaseLockGrantedAfterCancel() {
    holdInFirstSession(KEY);
    final var bodyRan = new AtomicBoolean();

    final var pending =
        R2dbcAdvisoryLocks.withLock(
                secondConn, KEY, LockMode.BLOCKING, c -> Mono.fromRunnable(() -> bodyRan.set(true)))
            .subscribe();
    assertEquals(1, server.waitingAcquirers());

    pending.dispose();
    assertEquals(1, server.waitingAcquirers());

    releaseInFirstSession(KEY);

    assertFalse(bodyRan.get());
    assertEquals(0, server.waitingAcquirers());
    assertEquals(0, second.locksHeld());
    assertEquals(
        List.of("SELECT pg_advisory_lock(?)", "SELECT pg_advisory_unlock(?)"), second.events());
  }

  @Test
  @DisplayName("Pair keys do not collide with single keys")
  void shouldSeparateKeySpaces() {
    holdInFirstSession(AdvisoryLockKey.of(0, 1));

    final var values =
        R2dbcAdvisoryLocks.withLockMany(
                secondConn, AdvisoryLockKey.of(1L), LockMode.NON_BLOCKING, c -> Flux.just(1, 2))
            .collectList()
            .block();

    assertEquals(List.of(1, 2), values);
  }

  @Test
  @DisplayName("Server lock timeout is reported as LockUnavailableException")
  void shouldTranslateLockTimeout() {
    second.failOn("SELECT pg_advisory_lock", "55P03", "canceling statement due to lock timeout");

    final var error =
        assertThrows(
            LockUnavailableException.class,
            () ->
                R2dbcAdvisoryLocks.withLock(secondConn, KEY, LockMode.BLOCKING, c -> Mono.just(1))
                    .block());

    assertEquals("55P03", error.sqlState());
  }

  @Test
  @DisplayName("Releasing a lock the server already dropped only logs a warning")
  void shouldWarnWhenLockAlreadyGone() {
    try (final var logs = LogCapture.forClass(R2dbcAdvisoryLocks.class)) {
      final var result =
          R2dbcAdvisoryLocks.withLock(
                  secondConn,
                  KEY,
                  LockMode.BLOCKING,
                  c -> Mono.fromRunnable(second::terminate).thenReturn("done"))
              .block();

      assertEquals("done", result);
      assertTrue(logs.messages(Level.WARNING).stream().anyMatch(m -> m.contains("was not held")));
    }
  }

  @Test
  @DisplayName("A failing release fails the scope")
  void shouldReportFailedRelease() {
    assertThrows(
        RestorationFailedException.class,
        () ->
            R2dbcAdvisoryLocks.withLock(
                    secondConn,
                    KEY,
                    LockMode.BLOCKING,
                    c ->
                        Mono.fromRunnable(
                                () -> second.failOn("SELECT pg_advisory_unlock", "08006", "lost"))
                            .thenReturn(1))
                .block());
  }

  @Test
  @DisplayName("Lock mode defaults to the configured setting")
  void shouldUseConfiguredMode() {
    System.setProperty(ToolboxSettings.LOCK_MODE_PROPERTY, "non_blocking");
    holdInFirstSession(KEY);

    assertThrows(
        LockUnavailableException.class,
        () -> R2dbcAdvisoryLocks.withLock(secondConn, KEY, c -> Mono.just(1)).block());
  }
}
