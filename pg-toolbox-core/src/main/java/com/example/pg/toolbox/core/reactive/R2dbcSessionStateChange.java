package com.example.pg.toolbox.core.reactive;

import com.example.pg.toolbox.core.errors.PgToolboxException;
import com.example.pg.toolbox.core.errors.StateChangeFailedException;
import io.r2dbc.spi.Connection;
import java.util.function.BiFunction;
import java.util.function.Function;
import reactor.core.publisher.Mono;

/**
 * A temporary change of session state on an R2DBC connection, paired with the way to undo it.
 *
 * <p>Both sides are lazy: nothing is sent to the server until the returned {@link Mono} is
 * subscribed. Implementations must not block.
 *
 * <pre>{@code
 * R2dbcSessionStateChange<String> searchPath =
 *     R2dbcSessionStateChange.of(
 *         "set search_path to reporting",
 *         conn ->
 *             R2dbcStatements.queryOne(conn, "SHOW search_path", String.class)
 *                 .flatMap(prev ->
 *                     R2dbcStatements.execute(conn, "SET search_path TO reporting")
 *                         .thenReturn(prev)),
 *         (conn, prev) -> R2dbcStatements.execute(conn, "SET search_path TO " + prev));
 *
 * Flux<Row> rows = R2dbcSessionScopes.usingMany(conn, searchPath, c -> queryTotals(c));
 * }</pre>
 *
 * @param <H> restore handle type
 */
public interface R2dbcSessionStateChange<H> {

  /**
   * Applies the change.
   *
   * @param conn connection to change
   * @return emits the restore handle; completing empty is an error
   */
  Mono<H> apply(Connection conn);

  /**
   * Undoes the change.
   *
   * @param conn connection the change was applied to
   * @param handle the handle emitted by {@link #apply(Connection)}
   * @return completes when the session is restored
   */
  Mono<Void> restore(Connection conn, H handle);

  /** Short description used in log and exception messages. */
  String describe();

  /**
   * Maps a failure of {@link #apply(Connection)} to the exception signalled to the subscriber.
   * Toolbox exceptions are passed through unchanged.
   */
  default PgToolboxException enterFailure(final Throwable error) {
    if (error instanceof PgToolboxException toolbox) return toolbox;
    return new StateChangeFailedException("Failed to " + describe(), error);
  }

  /**
   * Builds a change from two functions.
   *
   * @param description short description for messages
   * @param applier performs the change and emits the restore handle
   * @param restorer undoes the change
   * @param <H> restore handle type
   * @return the change
   */
  static <H> R2dbcSessionStateChange<H> of(
      final String description,
      final Function<Connection, Mono<H>> applier,
      final BiFunction<Connection, H, Mono<Void>> restorer) {
    return new R2dbcSessionStateChange<>() {
      @Override
      public Mono<H> apply(final Connection conn) {
        return applier.apply(conn);
      }

      @Override
      public Mono<Void> restore(final Connection conn, final H handle) {
        return restorer.apply(conn, handle);
      }

      @Override
      public String describe() {
        return description;
      }
    };
  }
}
