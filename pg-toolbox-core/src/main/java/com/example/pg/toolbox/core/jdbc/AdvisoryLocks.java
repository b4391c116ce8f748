package com.example.pg.toolbox.core.jdbc;

import static java.lang.System.Logger.Level.WARNING;

import com.example.pg.toolbox.core.ToolboxSettings;
import com.example.pg.toolbox.core.errors.ErrorTranslator;
import com.example.pg.toolbox.core.errors.LockUnavailableException;
import com.example.pg.toolbox.core.errors.PgToolboxException;
import com.example.pg.toolbox.core.errors.StateChangeFailedException;
import com.example.pg.toolbox.core.locks.AdvisoryLockKey;
import com.example.pg.toolbox.core.locks.LockMode;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Session-level advisory locks held for the duration of a scope.
 *
 * <pre>{@code
 * var key = AdvisoryLockKey.forName("billing:nightly-export");
 * try (var lock = AdvisoryLocks.acquire(conn, key, LockMode.NON_BLOCKING)) {
 *   exportInvoices(conn);
 * } catch (LockUnavailableException e) {
 *   // another instance is exporting
 * }
 * }</pre>
 *
 * <p>Session-level advisory locks outlive transactions, so the scope may span any number of
 * commits. The server drops them when the session ends.
 */
public final class AdvisoryLocks {

  private static final System.Logger logger = System.getLogger(AdvisoryLocks.class.getName());

  static final String UNLOCK = "pg_advisory_unlock";

  private AdvisoryLocks() {}

  /**
   * Acquires the lock in the configured default mode (see {@link
   * ToolboxSettings#defaultLockMode()}).
   *
   * @param conn connection that will own the lock
   * @param key lock key
   * @return the active scope; closing it releases the lock
   */
  public static SessionScope<AdvisoryLockKey> acquire(
      final Connection conn, final AdvisoryLockKey key) {
    return acquire(conn, key, ToolboxSettings.defaultLockMode());
  }

  /**
   * Acquires the lock.
   *
   * @param conn connection that will own the lock
   * @param key lock key
   * @param mode whether to wait for the lock
   * @return the active scope; closing it releases the lock
   * @throws LockUnavailableException in {@link LockMode#NON_BLOCKING} mode if another session
   *     holds the lock
   */
  public static SessionScope<AdvisoryLockKey> acquire(
      final Connection conn, final AdvisoryLockKey key, final LockMode mode) {
    return SessionScope.open(conn, lockChange(key, mode));
  }

  /**
   * Runs {@code work} while holding the lock, acquired in the configured default mode.
   *
   * @param conn connection that will own the lock
   * @param key lock key
   * @param work unit of work
   * @param <T> result type
   * @param <E> exception type thrown by the work
   * @return the work result
   * @throws E if the work fails
   */
  public static <T, E extends Exception> T withLock(
      final Connection conn, final AdvisoryLockKey key, final ConnectionCallback<T, E> work)
      throws E {
    return withLock(conn, key, ToolboxSettings.defaultLockMode(), work);
  }

  /**
   * Runs {@code work} while holding the lock.
   *
   * @param conn connection that will own the lock
   * @param key lock key
   * @param mode whether to wait for the lock
   * @param work unit of work
   * @param <T> result type
   * @param <E> exception type thrown by the work
   * @return the work result
   * @throws E if the work fails
   */
  public static <T, E extends Exception> T withLock(
      final Connection conn,
      final AdvisoryLockKey key,
      final LockMode mode,
      final ConnectionCallback<T, E> work)
      throws E {
    return SessionScopes.with(conn, lockChange(key, mode), work);
  }

  /**
   * Runs {@code work} only if the lock is free right now.
   *
   * @param conn connection that will own the lock
   * @param key lock key
   * @param work unit of work
   * @param <T> result type
   * @param <E> exception type thrown by the work
   * @return the work result
   * @throws LockUnavailableException if another session holds the lock
   * @throws E if the work fails
   */
  public static <T, E extends Exception> T tryWithLock(
      final Connection conn, final AdvisoryLockKey key, final ConnectionCallback<T, E> work)
      throws E {
    return withLock(conn, key, LockMode.NON_BLOCKING, work);
  }

  /**
   * Change that acquires the lock; the handle is the key itself.
   *
   * @param key lock key
   * @param mode whether to wait for the lock
   * @return the change
   */
  public static SessionStateChange<AdvisoryLockKey> lockChange(
      final AdvisoryLockKey key, final LockMode mode) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(mode, "mode");
    final var lockSql = key.call(mode.function(), i -> "?");
    final var unlockSql = key.call(UNLOCK, i -> "?");
    final var args = key.arguments().toArray();
    return new SessionStateChange<>() {
      @Override
      public AdvisoryLockKey apply(final Connection conn) throws SQLException {
        if (mode == LockMode.BLOCKING) {
          JdbcStatements.executeQuery(conn, lockSql, args);
          return key;
        }
        final var acquired = JdbcStatements.queryOne(conn, lockSql, Boolean.class, args);
        if (!Boolean.TRUE.equals(acquired)) throw new LockUnavailableException(key, null);
        return key;
      }

      @Override
      public void restore(final Connection conn, final AdvisoryLockKey handle)
          throws SQLException {
        final var released = JdbcStatements.queryOne(conn, unlockSql, Boolean.class, args);
        if (!Boolean.TRUE.equals(released)) {
          logger.log(WARNING, "Advisory lock {0} was not held at release", handle);
        }
      }

      @Override
      public String describe() {
        return "acquire advisory lock " + key;
      }

      @Override
      public PgToolboxException enterFailure(final Exception error) {
        if (error instanceof PgToolboxException toolbox) return toolbox;
        if (ErrorTranslator.isLockNotAvailable(error)) {
          return new LockUnavailableException(key, error);
        }
        return new StateChangeFailedException("Failed to " + describe(), error);
      }
    };
  }
}
