package com.example.pg.toolbox.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

import com.example.pg.toolbox.core.CatalogStatements;
import com.example.pg.toolbox.core.SqlIdentifiers;
import com.example.pg.toolbox.core.errors.ErrorTranslator;
import com.example.pg.toolbox.core.errors.PgToolboxException;
import com.example.pg.toolbox.core.errors.RestorationFailedException;
import com.example.pg.toolbox.core.scope.ScopeState;
import io.r2dbc.spi.Connection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Scoped changes of R2DBC session state that are always put back, mirroring {@link
 * com.example.pg.toolbox.core.jdbc.SessionScopes} for the blocking driver.
 *
 * <h2>Autocommit</h2>
 *
 * <pre>{@code
 * Mono<Void> vacuum =
 *     R2dbcSessionScopes.withAutocommit(conn, true, c ->
 *         R2dbcStatements.execute(c, "VACUUM ANALYZE orders"));
 * }</pre>
 *
 * <h2>Role switch</h2>
 *
 * <pre>{@code
 * Flux<String> names =
 *     R2dbcSessionScopes.withRoleMany(conn, "reporting", c ->
 *         Flux.from(c.createStatement("SELECT name FROM customers").execute())
 *             .flatMap(r -> r.map((row, md) -> row.get(0, String.class))));
 * }</pre>
 *
 * <h2>Guarantees</h2>
 *
 * <ul>
 *   <li>Nothing is sent until subscription; every subscription is a scope of its own.
 *   <li>The previous state is restored exactly once, whether the body completes, fails or is
 *       cancelled.
 *   <li>A restoration failure after normal completion is signalled as {@link
 *       RestorationFailedException}. After a body failure it is attached to the body's error as a
 *       suppressed exception. After cancellation there is no subscriber left to tell, so it is
 *       logged at {@code ERROR}.
 *   <li>On cancellation the restore is subscribed before the cancel signal travels further
 *       downstream. A change that is still being applied when the subscriber cancels runs to
 *       completion and is then restored.
 * </ul>
 *
 * <p>A connection must not carry two active scopes at the same time.
 */
public final class R2dbcSessionScopes {

  private static final System.Logger logger = System.getLogger(R2dbcSessionScopes.class.getName());

  private R2dbcSessionScopes() {}

  /**
   * Runs {@code body} with autocommit set to {@code target}, then restores the previous value.
   *
   * @param conn connection to change
   * @param target autocommit value inside the scope
   * @param body unit of work
   * @param <T> result type
   * @return the body result
   */
  public static <T> Mono<T> withAutocommit(
      final Connection conn, final boolean target, final Function<Connection, Mono<T>> body) {
    return using(conn, autocommitChange(target), body);
  }

  /** Multi-valued variant of {@link #withAutocommit(Connection, boolean, Function)}. */
  public static <T> Flux<T> withAutocommitMany(
      final Connection conn,
      final boolean target,
      final Function<Connection, ? extends Publisher<T>> body) {
    return usingMany(conn, autocommitChange(target), body);
  }

  /**
   * Runs {@code body} as {@code role}, then switches back to the previous role.
   *
   * @param conn connection to change
   * @param role role to assume
   * @param body unit of work
   * @param <T> result type
   * @return the body result; fails with {@link com.example.pg.toolbox.core.errors.RoleException}
   *     if the role does not exist or may not be assumed
   * @throws IllegalArgumentException if the role name is blank
   */
  public static <T> Mono<T> withRole(
      final Connection conn, final String role, final Function<Connection, Mono<T>> body) {
    return using(conn, roleChange(role), body);
  }

  /** Multi-valued variant of {@link #withRole(Connection, String, Function)}. */
  public static <T> Flux<T> withRoleMany(
      final Connection conn,
      final String role,
      final Function<Connection, ? extends Publisher<T>> body) {
    return usingMany(conn, roleChange(role), body);
  }

  /**
   * Runs {@code body} with {@code change} applied, then restores the session.
   *
   * @param conn connection to change
   * @param change the change
   * @param body unit of work
   * @param <H> restore handle type
   * @param <T> result type
   * @return the body result
   */
  public static <H, T> Mono<T> using(
      final Connection conn,
      final R2dbcSessionStateChange<H> change,
      final Function<Connection, Mono<T>> body) {
    // singleOrEmpty rather than next: the scope must see the body complete, not get cancelled
    return usingMany(conn, change, body).singleOrEmpty();
  }

  /**
   * Runs {@code body} with {@code change} applied, then restores the session.
   *
   * @param conn connection to change
   * @param change the change
   * @param body unit of work
   * @param <H> restore handle type
   * @param <T> element type
   * @return the body elements
   */
  public static <H, T> Flux<T> usingMany(
      final Connection conn,
      final R2dbcSessionStateChange<H> change,
      final Function<Connection, ? extends Publisher<T>> body) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(change, "change");
    Objects.requireNonNull(body, "body");
    return Flux.defer(
        () -> {
          final var state = new AtomicReference<>(ScopeState.UNENTERED);
          final var completionError = new AtomicReference<Throwable>();
          return Flux.usingWhen(
                  enter(conn, change, state),
                  handle -> body.apply(conn),
                  handle ->
                      restore(conn, change, handle, state)
                          .onErrorResume(
                              e -> {
                                completionError.set(e);
                                return Mono.empty();
                              }),
                  (handle, err) ->
                      restore(conn, change, handle, state)
                          .onErrorResume(
                              e -> {
                                err.addSuppressed(e);
                                return Mono.empty();
                              }),
                  handle -> restoreAfterCancel(conn, change, handle, state))
              .concatWith(
                  Mono.defer(
                      () -> {
                        final var e = completionError.get();
                        return e == null ? Mono.<T>empty() : Mono.<T>error(e);
                      }));
        });
  }

  private static <H> Mono<H> enter(
      final Connection conn,
      final R2dbcSessionStateChange<H> change,
      final AtomicReference<ScopeState> state) {
    final var applied =
        Mono.defer(() -> change.apply(conn))
            .switchIfEmpty(
                Mono.error(
                    () ->
                        new IllegalStateException(
                            change.describe() + " produced no restore handle")))
            .onErrorMap(
                e -> {
                  state.updateAndGet(s -> s.transitionTo(ScopeState.FAILED_TO_ENTER));
                  logger.log(DEBUG, "Failed to enter scope: {0}", change.describe());
                  return change.enterFailure(e);
                })
            .doOnNext(
                handle -> {
                  state.updateAndGet(s -> s.transitionTo(ScopeState.ACTIVE));
                  logger.log(DEBUG, "Entered scope: {0}", change.describe());
                });
    // The apply outlives a cancelled subscriber: a statement already sent keeps running on the
    // server, and whatever it changed is restored when its handle arrives.
    return Mono.create(
        sink -> {
          final var pending = new Entered<H>(null);
          final var abandoned = new Entered<H>(null);
          final var outcome = new AtomicReference<>(pending);
          sink.onCancel(
              () -> {
                final var seen = outcome.getAndSet(abandoned);
                if (seen != pending && seen != abandoned) {
                  restoreAfterCancel(conn, change, seen.handle(), state).subscribe();
                }
              });
          applied.subscribe(
              handle -> {
                if (outcome.compareAndSet(pending, new Entered<>(handle))) {
                  sink.success(handle);
                } else {
                  final var what = change.describe();
                  logger.log(DEBUG, "Entered after cancellation, restoring: {0}", what);
                  restoreAfterCancel(conn, change, handle, state).subscribe();
                }
              },
              error -> {
                if (outcome.compareAndSet(pending, abandoned)) {
                  sink.error(error);
                } else {
                  logger.log(DEBUG, "Entry failed after cancellation: " + change.describe(), error);
                }
              });
        });
  }

  private static <H> Mono<Void> restoreAfterCancel(
      final Connection conn,
      final R2dbcSessionStateChange<H> change,
      final H handle,
      final AtomicReference<ScopeState> state) {
    return restore(conn, change, handle, state)
        .onErrorResume(
            e -> {
              logger.log(ERROR, "Restore after cancellation failed: " + change.describe(), e);
              return Mono.empty();
            });
  }

  private static <H> Mono<Void> restore(
      final Connection conn,
      final R2dbcSessionStateChange<H> change,
      final H handle,
      final AtomicReference<ScopeState> state) {
    return Mono.defer(() -> change.restore(conn, handle))
        .onErrorMap(
            e -> {
              state.updateAndGet(s -> s.transitionTo(ScopeState.RESTORED_WITH_ERROR));
              logger.log(WARNING, "Failed to restore after scope: {0}", change.describe());
              return new RestorationFailedException(
                  "Failed to restore after " + change.describe(), e);
            })
        .doOnSuccess(
            v -> {
              state.updateAndGet(s -> s.transitionTo(ScopeState.RESTORED));
              logger.log(DEBUG, "Restored after scope: {0}", change.describe());
            });
  }

  private record Entered<H>(H handle) {}

  /**
   * Change that sets autocommit to {@code target}; the handle is the previous value.
   *
   * @param target autocommit value inside the scope
   * @return the change
   */
  public static R2dbcSessionStateChange<Boolean> autocommitChange(final boolean target) {
    return R2dbcSessionStateChange.of(
        "set autocommit=" + target,
        conn ->
            Mono.fromSupplier(conn::isAutoCommit)
                .flatMap(previous -> Mono.from(conn.setAutoCommit(target)).thenReturn(previous)),
        (conn, previous) -> Mono.from(conn.setAutoCommit(previous)));
  }

  /**
   * Change that switches to {@code role}; the handle is the previous {@code current_user}.
   *
   * @param role role to assume
   * @return the change
   * @throws IllegalArgumentException if the role name is blank
   */
  public static R2dbcSessionStateChange<String> roleChange(final String role) {
    SqlIdentifiers.requireName(role, "role");
    final var setRole = CatalogStatements.setRole(role);
    return new R2dbcSessionStateChange<>() {
      @Override
      public Mono<String> apply(final Connection conn) {
        return R2dbcStatements.queryOne(conn, CatalogStatements.CURRENT_USER, String.class)
            .flatMap(previous -> R2dbcStatements.execute(conn, setRole).thenReturn(previous));
      }

      @Override
      public Mono<Void> restore(final Connection conn, final String previous) {
        return R2dbcStatements.execute(conn, CatalogStatements.setRole(previous));
      }

      @Override
      public String describe() {
        return "switch to role \"" + role + "\"";
      }

      @Override
      public PgToolboxException enterFailure(final Throwable error) {
        if (error instanceof PgToolboxException toolbox) return toolbox;
        return ErrorTranslator.roleSwitchFailure(role, error);
      }
    };
  }
}
