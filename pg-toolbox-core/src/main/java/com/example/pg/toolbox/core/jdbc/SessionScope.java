package com.example.pg.toolbox.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.pg.toolbox.core.errors.RestorationFailedException;
import com.example.pg.toolbox.core.scope.ScopeState;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * An active session state change on a JDBC connection, undone by {@link #close()}.
 *
 * <p>Use with try-with-resources. Restoration then runs on every exit path: normal completion, any
 * exception from the block, and thread interruption surfacing as an exception. If the block threw
 * and restoration fails too, the block's exception propagates with the {@link
 * RestorationFailedException} attached as suppressed.
 *
 * <pre>{@code
 * try (var scope = SessionScopes.role(conn, "reporting")) {
 *   try (var stmt = scope.connection().createStatement()) {
 *     stmt.executeQuery("SELECT * FROM monthly_totals");
 *   }
 * }
 * }</pre>
 *
 * <p>Not thread-safe. A connection must not carry two active scopes at the same time from
 * different threads, since the state they change belongs to the whole session.
 *
 * @param <H> restore handle type
 */
public final class SessionScope<H> implements AutoCloseable {

  private static final System.Logger logger = System.getLogger(SessionScope.class.getName());

  private final Connection connection;
  private final SessionStateChange<H> change;
  private H handle;
  private ScopeState state = ScopeState.UNENTERED;

  private SessionScope(final Connection connection, final SessionStateChange<H> change) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.change = Objects.requireNonNull(change, "change");
  }

  static <H> SessionScope<H> open(final Connection connection, final SessionStateChange<H> change) {
    final var scope = new SessionScope<>(connection, change);
    scope.enter();
    return scope;
  }

  private void enter() {
    final H applied;
    try {
      applied = Objects.requireNonNull(change.apply(connection), "restore handle");
    } catch (final SQLException | RuntimeException e) {
      state = state.transitionTo(ScopeState.FAILED_TO_ENTER);
      logger.log(DEBUG, "Failed to enter scope: {0}", change.describe());
      throw change.enterFailure(e);
    }
    handle = applied;
    state = state.transitionTo(ScopeState.ACTIVE);
    logger.log(DEBUG, "Entered scope: {0}", change.describe());
  }

  /** The connection the scope was opened on. */
  public Connection connection() {
    return connection;
  }

  /** The restore handle, e.g. the value the session had before the scope was entered. */
  public H handle() {
    return handle;
  }

  /** Current lifecycle state. */
  public ScopeState state() {
    return state;
  }

  /**
   * Restores the session state. Runs the restoration at most once; later calls do nothing.
   *
   * @throws RestorationFailedException if the session could not be restored
   */
  @Override
  public void close() {
    if (state != ScopeState.ACTIVE) return;
    try {
      change.restore(connection, handle);
    } catch (final SQLException | RuntimeException e) {
      state = state.transitionTo(ScopeState.RESTORED_WITH_ERROR);
      logger.log(WARNING, "Failed to restore after scope: {0}", change.describe());
      throw new RestorationFailedException("Failed to restore after " + change.describe(), e);
    }
    state = state.transitionTo(ScopeState.RESTORED);
    logger.log(DEBUG, "Restored after scope: {0}", change.describe());
  }
}
