package com.example.pg.toolbox.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;

import com.example.pg.toolbox.core.ToolboxSettings;
import com.example.pg.toolbox.core.errors.ErrorKind;
import com.example.pg.toolbox.core.errors.LockUnavailableException;
import com.example.pg.toolbox.core.errors.RestorationFailedException;
import com.example.pg.toolbox.core.errors.StateChangeFailedException;
import com.example.pg.toolbox.core.locks.AdvisoryLockKey;
import com.example.pg.toolbox.core.locks.LockMode;
import com.example.pg.toolbox.core.scope.ScopeState;
import com.example.pg.toolbox.core.testing.FakeJdbc;
import com.example.pg.toolbox.core.testing.FakePostgres;
import com.example.pg.toolbox.core.testing.LogCapture;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import org.junit.jupiter.api.*;

class AdvisoryLocksTest {

  private static final AdvisoryLockKey KEY = AdvisoryLockKey.forName("billing:nightly-export");

  private FakePostgres server;
  private FakePostgres.Session first;
  private FakePostgres.Session second;
  private Connection firstConn;
  private Connection secondConn;

  @BeforeEach
  void setUp() throws SQLException {
    server = new FakePostgres().withRole("app");
    first = server.connect("app");
    second = server.connect("app");
    firstConn = FakeJdbc.connect(first);
    secondConn = FakeJdbc.connect(second);
  }

  @AfterEach
  void tearDown() {
    System.clearProperty(ToolboxSettings.LOCK_MODE_PROPERTY);
  }

  @Test
  @DisplayName("Should hold the lock for the scope and release it on close")
  void shouldAcquireAndRelease() {
    try (final var lock = AdvisoryLocks.acquire(firstConn, KEY, LockMode.NON_BLOCKING)) {
      assertEquals(KEY, lock.handle());
      assertEquals(1, first.locksHeld());
    }

    assertEquals(0, first.locksHeld());
    assertTrue(first.events().contains("SELECT pg_try_advisory_lock(?)"));
    assertTrue(first.events().contains("SELECT pg_advisory_unlock(?)"));
  }

  @Test
  @DisplayName("Non-blocking acquire fails fast when another session holds the lock")
  void shouldFailFastWhenHeld() {
    try (final var held = AdvisoryLocks.acquire(firstConn, KEY, LockMode.BLOCKING)) {
      final var error =
          assertThrows(
              LockUnavailableException.class,
              () -> AdvisoryLocks.tryWithLock(secondConn, KEY, c -> fail("must not run")));

      assertEquals(KEY, error.key());
      assertEquals(ErrorKind.LOCK_UNAVAILABLE, error.kind());
      assertEquals(1, first.locksHeld());
      assertFalse(second.events().contains("SELECT pg_advisory_unlock(?)"));
    }
  }

  @Test
  @DisplayName("Blocking acquire waits until the holder releases")
  void shouldWaitForRelease() throws Exception {
    final var holder = AdvisoryLocks.acquire(firstConn, KEY, LockMode.BLOCKING);
    final var acquired = new CountDownLatch(1);
    final var failure = new AtomicReference<Throwable>();
    final var waiter =
        new Thread(
            () -> {
              try {
                AdvisoryLocks.withLock(
                    secondConn,
                    KEY,
                    LockMode.BLOCKING,
                    c -> {
                      acquired.countDown();
                      return null;
                    });
              } catch (final RuntimeException e) {
                failure.set(e);
              }
            });
    waiter.start();

    awaitWaiters(1);
    assertEquals(1, acquired.getCount());

    holder.close();
    assertTrue(acquired.await(5, TimeUnit.SECONDS));
    waiter.join(TimeUnit.SECONDS.toMillis(5));

    assertNull(failure.get());
    assertEquals(0, first.locksHeld());
    assertEquals(0, second.locksHeld());
  }

  @Test
  @DisplayName("Single and pair keys live in separate key spaces")
  void shouldSeparateKeySpaces() {
    try (final var pair = AdvisoryLocks.acquire(firstConn, AdvisoryLockKey.of(0, 1))) {
      final var result =
          AdvisoryLocks.tryWithLock(secondConn, AdvisoryLockKey.of(1L), c -> "single");
      assertEquals("single", result);
      assertTrue(first.events().contains("SELECT pg_advisory_lock(?, ?)"));
    }
  }

  @Test
  @DisplayName("Server lock timeout is reported as LockUnavailableException")
  void shouldTranslateLockTimeout() {
    second.failOn("SELECT pg_advisory_lock", "55P03", "canceling statement due to lock timeout");

    final var error =
        assertThrows(
            LockUnavailableException.class,
            () -> AdvisoryLocks.acquire(secondConn, KEY, LockMode.BLOCKING));

    assertEquals("55P03", error.sqlState());
  }

  @Test
  @DisplayName("Other acquisition errors stay StateChangeFailedException")
  void shouldWrapOtherErrors() {
    second.breakConnection();

    final var error =
        assertThrows(
            StateChangeFailedException.class,
            () -> AdvisoryLocks.acquire(secondConn, KEY, LockMode.NON_BLOCKING));

    assertFalse(error instanceof LockUnavailableException);
    assertEquals("08006", error.sqlState());
  }

  @Test
  @DisplayName("Releasing a lock the server already dropped only logs a warning")
  void shouldWarnWhenLockAlreadyGone() {
    try (final var logs = LogCapture.forClass(AdvisoryLocks.class)) {
      final var lock = AdvisoryLocks.acquire(firstConn, KEY, LockMode.BLOCKING);
      first.terminate();

      assertDoesNotThrow(lock::close);

      assertEquals(ScopeState.RESTORED, lock.state());
      assertTrue(logs.messages(Level.WARNING).stream().anyMatch(m -> m.contains("was not held")));
    }
  }

  @Test
  @DisplayName("A failing release is a restoration failure")
  void shouldReportFailedRelease() {
    final var lock = AdvisoryLocks.acquire(firstConn, KEY, LockMode.BLOCKING);
    first.failOn("SELECT pg_advisory_unlock", "08006", "connection lost");

    assertThrows(RestorationFailedException.class, lock::close);
    assertEquals(ScopeState.RESTORED_WITH_ERROR, lock.state());
  }

  @Test
  @DisplayName("Lock mode defaults to the configured setting")
  void shouldUseConfiguredMode() {
    System.setProperty(ToolboxSettings.LOCK_MODE_PROPERTY, "NON_BLOCKING");
    try (final var held = AdvisoryLocks.acquire(firstConn, KEY)) {
      assertThrows(LockUnavailableException.class, () -> AdvisoryLocks.acquire(secondConn, KEY));
      assertTrue(second.events().contains("SELECT pg_try_advisory_lock(?)"));
    }
  }

  @Test
  @DisplayName("The lock is released when the body fails")
  void shouldReleaseAfterBodyError() {
    assertThrows(
        IllegalStateException.class,
        () ->
            AdvisoryLocks.withLock(
                firstConn,
                KEY,
                c -> {
                  throw new IllegalStateException("boom");
                }));

    assertEquals(0, first.locksHeld());
  }

  private void awaitWaiters(final int expected) throws InterruptedException {
    final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (server.waitingAcquirers() < expected) {
      if (System.nanoTime() > deadline) fail("no session started waiting for the lock");
      Thread.sleep(10);
    }
  }
}
