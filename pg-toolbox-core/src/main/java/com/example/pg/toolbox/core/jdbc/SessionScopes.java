package com.example.pg.toolbox.core.jdbc;

import com.example.pg.toolbox.core.CatalogStatements;
import com.example.pg.toolbox.core.SqlIdentifiers;
import com.example.pg.toolbox.core.errors.ErrorTranslator;
import com.example.pg.toolbox.core.errors.PgToolboxException;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Scoped changes of JDBC session state that are always put back.
 *
 * <h2>Autocommit</h2>
 *
 * <pre>{@code
 * try (var scope = SessionScopes.autocommit(conn, true)) {
 *   JdbcStatements.execute(conn, "VACUUM ANALYZE orders");
 * }
 * // conn.getAutoCommit() is back to its previous value
 * }</pre>
 *
 * <h2>Role switch</h2>
 *
 * <pre>{@code
 * long count = SessionScopes.withRole(conn, "reporting", c ->
 *     JdbcStatements.queryOne(c, "SELECT count(*) FROM orders", Long.class));
 * }</pre>
 *
 * <p>Failures to enter a scope raise {@link
 * com.example.pg.toolbox.core.errors.StateChangeFailedException} ({@link
 * com.example.pg.toolbox.core.errors.RoleException} for an unknown or forbidden role).
 * Failures to restore raise {@link com.example.pg.toolbox.core.errors.RestorationFailedException},
 * attached as suppressed when the scope body failed as well.
 */
public final class SessionScopes {

  private SessionScopes() {}

  /**
   * Sets autocommit to {@code target} until the returned scope is closed.
   *
   * @param conn connection to change
   * @param target autocommit value inside the scope
   * @return the active scope; its handle is the previous autocommit value
   */
  public static SessionScope<Boolean> autocommit(final Connection conn, final boolean target) {
    return open(conn, autocommitChange(target));
  }

  /**
   * Switches the session to {@code role} ({@code SET ROLE}) until the returned scope is closed.
   *
   * @param conn connection to change
   * @param role role to assume
   * @return the active scope; its handle is the previous {@code current_user}
   */
  public static SessionScope<String> role(final Connection conn, final String role) {
    return open(conn, roleChange(role));
  }

  /**
   * Applies an arbitrary session state change until the returned scope is closed.
   *
   * @param conn connection to change
   * @param change the change
   * @param <H> restore handle type
   * @return the active scope
   */
  public static <H> SessionScope<H> open(
      final Connection conn, final SessionStateChange<H> change) {
    return SessionScope.open(conn, change);
  }

  /**
   * Runs {@code work} with autocommit set to {@code target}, then restores the previous value.
   *
   * @param conn connection to change
   * @param target autocommit value inside the scope
   * @param work unit of work
   * @param <T> result type
   * @param <E> exception type thrown by the work
   * @return the work result
   * @throws E if the work fails
   */
  public static <T, E extends Exception> T withAutocommit(
      final Connection conn, final boolean target, final ConnectionCallback<T, E> work) throws E {
    return with(conn, autocommitChange(target), work);
  }

  /**
   * Runs {@code work} as {@code role}, then switches back to the previous role.
   *
   * @param conn connection to change
   * @param role role to assume
   * @param work unit of work
   * @param <T> result type
   * @param <E> exception type thrown by the work
   * @return the work result
   * @throws E if the work fails
   */
  public static <T, E extends Exception> T withRole(
      final Connection conn, final String role, final ConnectionCallback<T, E> work) throws E {
    return with(conn, roleChange(role), work);
  }

  /**
   * Runs {@code work} with {@code change} applied, then restores the session.
   *
   * @param conn connection to change
   * @param change the change
   * @param work unit of work
   * @param <H> restore handle type
   * @param <T> result type
   * @param <E> exception type thrown by the work
   * @return the work result
   * @throws E if the work fails
   */
  public static <H, T, E extends Exception> T with(
      final Connection conn,
      final SessionStateChange<H> change,
      final ConnectionCallback<T, E> work)
      throws E {
    try (final var scope = open(conn, change)) {
      return work.execute(scope.connection());
    }
  }

  /**
   * Change that sets autocommit to {@code target}; the handle is the previous value.
   *
   * @param target autocommit value inside the scope
   * @return the change
   */
  public static SessionStateChange<Boolean> autocommitChange(final boolean target) {
    return SessionStateChange.of(
        "set autocommit=" + target,
        conn -> {
          final var previous = conn.getAutoCommit();
          conn.setAutoCommit(target);
          return previous;
        },
        Connection::setAutoCommit);
  }

  /**
   * Change that switches to {@code role}; the handle is the previous {@code current_user}.
   * Authorization failures are raised as {@link com.example.pg.toolbox.core.errors.RoleException}.
   *
   * @param role role to assume
   * @return the change
   * @throws IllegalArgumentException if the role name is blank
   */
  public static SessionStateChange<String> roleChange(final String role) {
    SqlIdentifiers.requireName(role, "role");
    final var setRole = CatalogStatements.setRole(role);
    return new SessionStateChange<>() {
      @Override
      public String apply(final Connection conn) throws SQLException {
        final var previous =
            JdbcStatements.queryOne(conn, CatalogStatements.CURRENT_USER, String.class);
        if (previous == null) throw new SQLException("current_user returned no value");
        JdbcStatements.execute(conn, setRole);
        return previous;
      }

      @Override
      public void restore(final Connection conn, final String previous) throws SQLException {
        JdbcStatements.execute(conn, CatalogStatements.setRole(previous));
      }

      @Override
      public String describe() {
        return "switch to role \"" + role + "\"";
      }

      @Override
      public PgToolboxException enterFailure(final Exception error) {
        if (error instanceof PgToolboxException toolbox) return toolbox;
        return ErrorTranslator.roleSwitchFailure(role, error);
      }
    };
  }
}
