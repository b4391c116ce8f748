package com.example.pg.toolbox.core.jdbc;

import com.example.pg.toolbox.core.errors.PgToolboxException;
import com.example.pg.toolbox.core.errors.StateChangeFailedException;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * A temporary change of session state on a JDBC connection, paired with the way to undo it.
 *
 * <p>{@link #apply(Connection)} performs the change and returns a restore handle: whatever {@link
 * #restore(Connection, Object)} needs to put the session back, typically the previous value.
 *
 * <pre>{@code
 * SessionStateChange<String> searchPath =
 *     SessionStateChange.of(
 *         "set search_path to reporting",
 *         conn -> {
 *           String previous = JdbcStatements.queryOne(conn, "SHOW search_path", String.class);
 *           JdbcStatements.execute(conn, "SET search_path TO reporting");
 *           return previous;
 *         },
 *         (conn, previous) -> JdbcStatements.execute(conn, "SET search_path TO " + previous));
 *
 * try (var scope = SessionScopes.open(conn, searchPath)) {
 *   // queries resolve against reporting
 * }
 * }</pre>
 *
 * @param <H> restore handle type
 */
public interface SessionStateChange<H> {

  /**
   * Applies the change.
   *
   * @param conn connection to change
   * @return handle passed to {@link #restore(Connection, Object)}, never null
   * @throws SQLException if the change could not be made
   */
  H apply(final Connection conn) throws SQLException;

  /**
   * Undoes the change.
   *
   * @param conn connection the change was applied to
   * @param handle the handle returned by {@link #apply(Connection)}
   * @throws SQLException if the session could not be restored
   */
  void restore(final Connection conn, final H handle) throws SQLException;

  /** Short description used in log and exception messages, e.g. {@code "set autocommit=true"}. */
  String describe();

  /**
   * Maps a failure of {@link #apply(Connection)} to the exception raised to the caller. Toolbox
   * exceptions raised by {@code apply} itself are passed through unchanged.
   *
   * @param error the failure
   * @return the exception to raise
   */
  default PgToolboxException enterFailure(final Exception error) {
    if (error instanceof PgToolboxException toolbox) return toolbox;
    return new StateChangeFailedException("Failed to " + describe(), error);
  }

  /** Applies the change. */
  @FunctionalInterface
  interface Applier<H> {
    H apply(Connection conn) throws SQLException;
  }

  /** Undoes the change. */
  @FunctionalInterface
  interface Restorer<H> {
    void restore(Connection conn, H handle) throws SQLException;
  }

  /**
   * Builds a change from two functions.
   *
   * @param description short description for messages
   * @param applier performs the change and returns the restore handle
   * @param restorer undoes the change
   * @param <H> restore handle type
   * @return the change
   */
  static <H> SessionStateChange<H> of(
      final String description, final Applier<H> applier, final Restorer<H> restorer) {
    return new SessionStateChange<>() {
      @Override
      public H apply(final Connection conn) throws SQLException {
        return applier.apply(conn);
      }

      @Override
      public void restore(final Connection conn, final H handle) throws SQLException {
        restorer.restore(conn, handle);
      }

      @Override
      public String describe() {
        return description;
      }
    };
  }
}
