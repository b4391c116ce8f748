package com.example.pg.toolbox.core.reactive;

import static java.lang.System.Logger.Level.WARNING;

import com.example.pg.toolbox.core.ToolboxSettings;
import com.example.pg.toolbox.core.errors.ErrorTranslator;
import com.example.pg.toolbox.core.errors.LockUnavailableException;
import com.example.pg.toolbox.core.errors.PgToolboxException;
import com.example.pg.toolbox.core.errors.StateChangeFailedException;
import com.example.pg.toolbox.core.locks.AdvisoryLockKey;
import com.example.pg.toolbox.core.locks.LockMode;
import io.r2dbc.spi.Connection;
import java.util.Objects;
import java.util.function.Function;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Session-level advisory locks held for the duration of a reactive scope.
 *
 * <pre>{@code
 * var key = AdvisoryLockKey.forName("billing:nightly-export");
 * Mono<Long> exported =
 *     R2dbcAdvisoryLocks.withLock(conn, key, LockMode.NON_BLOCKING, c -> exportInvoices(c))
 *         .onErrorResume(LockUnavailableException.class, e -> Mono.just(0L));
 * }</pre>
 *
 * <p>A {@link LockMode#BLOCKING} acquisition completes only once the server grants the lock.
 * Cancelling the subscription while waiting abandons the scope, but the statement already sent
 * keeps waiting on the server. If the lock is granted later it is released straight away.
 */
public final class R2dbcAdvisoryLocks {

  private static final System.Logger logger = System.getLogger(R2dbcAdvisoryLocks.class.getName());

  private static final String UNLOCK = "pg_advisory_unlock";

  private R2dbcAdvisoryLocks() {}

  /** Runs {@code body} holding the lock, acquired in the configured default mode. */
  public static <T> Mono<T> withLock(
      final Connection conn, final AdvisoryLockKey key, final Function<Connection, Mono<T>> body) {
    return withLock(conn, key, ToolboxSettings.defaultLockMode(), body);
  }

  /**
   * Runs {@code body} holding the lock.
   *
   * @param conn connection that will own the lock
   * @param key lock key
   * @param mode whether to wait for the lock
   * @param body unit of work
   * @param <T> result type
   * @return the body result; fails with {@link LockUnavailableException} in {@link
   *     LockMode#NON_BLOCKING} mode if another session holds the lock
   */
  public static <T> Mono<T> withLock(
      final Connection conn,
      final AdvisoryLockKey key,
      final LockMode mode,
      final Function<Connection, Mono<T>> body) {
    return R2dbcSessionScopes.using(conn, lockChange(key, mode), body);
  }

  /** Multi-valued variant, lock acquired in the configured default mode. */
  public static <T> Flux<T> withLockMany(
      final Connection conn,
      final AdvisoryLockKey key,
      final Function<Connection, ? extends Publisher<T>> body) {
    return withLockMany(conn, key, ToolboxSettings.defaultLockMode(), body);
  }

  /** Multi-valued variant of {@link #withLock(Connection, AdvisoryLockKey, LockMode, Function)}. */
  public static <T> Flux<T> withLockMany(
      final Connection conn,
      final AdvisoryLockKey key,
      final LockMode mode,
      final Function<Connection, ? extends Publisher<T>> body) {
    return R2dbcSessionScopes.usingMany(conn, lockChange(key, mode), body);
  }

  /**
   * Change that acquires the lock; the handle is the key itself.
   *
   * @param key lock key
   * @param mode whether to wait for the lock
   * @return the change
   */
  public static R2dbcSessionStateChange<AdvisoryLockKey> lockChange(
      final AdvisoryLockKey key, final LockMode mode) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(mode, "mode");
    final var lockSql = key.call(mode.function(), R2dbcStatements::placeholder);
    final var unlockSql = key.call(UNLOCK, R2dbcStatements::placeholder);
    final var args = key.arguments().toArray();
    return new R2dbcSessionStateChange<>() {
      @Override
      public Mono<AdvisoryLockKey> apply(final Connection conn) {
        if (mode == LockMode.BLOCKING) {
          return R2dbcStatements.execute(conn, lockSql, args).thenReturn(key);
        }
        return R2dbcStatements.queryOne(conn, lockSql, Boolean.class, args)
            .defaultIfEmpty(Boolean.FALSE)
            .flatMap(
                acquired ->
                    acquired
                        ? Mono.just(key)
                        : Mono.error(new LockUnavailableException(key, null)));
      }

      @Override
      public Mono<Void> restore(final Connection conn, final AdvisoryLockKey handle) {
        return R2dbcStatements.queryOne(conn, unlockSql, Boolean.class, args)
            .defaultIfEmpty(Boolean.FALSE)
            .doOnNext(
                released -> {
                  if (!released) {
                    logger.log(WARNING, "Advisory lock {0} was not held at release", handle);
                  }
                })
            .then();
      }

      @Override
      public String describe() {
        return "acquire advisory lock " + key;
      }

      @Override
      public PgToolboxException enterFailure(final Throwable error) {
        if (error instanceof PgToolboxException toolbox) return toolbox;
        if (ErrorTranslator.isLockNotAvailable(error)) {
          return new LockUnavailableException(key, error);
        }
        return new StateChangeFailedException("Failed to " + describe(), error);
      }
    };
  }
}
