package com.example.pg.toolbox.core.reactive;

import com.example.pg.toolbox.core.CatalogStatements;
import com.example.pg.toolbox.core.ToolboxSettings;
import io.r2dbc.spi.Batch;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionMetadata;
import io.r2dbc.spi.IsolationLevel;
import io.r2dbc.spi.Result;
import io.r2dbc.spi.Statement;
import io.r2dbc.spi.TransactionDefinition;
import io.r2dbc.spi.ValidationDepth;
import io.r2dbc.spi.Wrapped;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * R2DBC connection decorator that writes the SQL it runs to the log.
 *
 * <p>Statements are logged when their {@code execute()} publisher is subscribed, so a statement
 * that is built but never run leaves no trace. Autocommit changes and transaction boundaries are
 * logged the same way. Role passwords are masked. All other calls go straight to the delegate.
 *
 * <pre>{@code
 * Mono.usingWhen(
 *     Mono.from(connectionFactory.create()).map(LoggingConnection::wrap),
 *     conn -> R2dbcSessionScopes.withRole(conn, "reporting", c -> totals(c)),
 *     Connection::close);
 * }</pre>
 */
public final class LoggingConnection implements Connection, Wrapped<Connection> {

  private static final System.Logger logger = System.getLogger(LoggingConnection.class.getName());

  private final Connection delegate;
  private final System.Logger.Level level;

  private LoggingConnection(final Connection delegate, final System.Logger.Level level) {
    this.delegate = delegate;
    this.level = level;
  }

  /**
   * Wraps a connection, logging at the configured level (see {@link
   * ToolboxSettings#statementLogLevel()}).
   */
  public static Connection wrap(final Connection conn) {
    return wrap(conn, ToolboxSettings.statementLogLevel());
  }

  /** Wraps a connection, logging at the given level. */
  public static Connection wrap(final Connection conn, final System.Logger.Level level) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(level, "level");
    if (conn instanceof LoggingConnection) return conn;
    return new LoggingConnection(conn, level);
  }

  @Override
  public Connection unwrap() {
    return delegate;
  }

  private Mono<Void> logged(final String what, final Publisher<Void> action) {
    return Mono.defer(
        () -> {
          logger.log(level, what);
          return Mono.from(action);
        });
  }

  @Override
  public Publisher<Void> beginTransaction() {
    return logged("BEGIN", delegate.beginTransaction());
  }

  @Override
  public Publisher<Void> beginTransaction(final TransactionDefinition definition) {
    return logged("BEGIN " + definition, delegate.beginTransaction(definition));
  }

  @Override
  public Publisher<Void> close() {
    return delegate.close();
  }

  @Override
  public Publisher<Void> commitTransaction() {
    return logged("COMMIT", delegate.commitTransaction());
  }

  @Override
  public Batch createBatch() {
    return new LoggingBatch(delegate.createBatch());
  }

  @Override
  public Publisher<Void> createSavepoint(final String name) {
    return logged("SAVEPOINT " + name, delegate.createSavepoint(name));
  }

  @Override
  public Statement createStatement(final String sql) {
    return new LoggingStatement(delegate.createStatement(sql), sql);
  }

  @Override
  public boolean isAutoCommit() {
    return delegate.isAutoCommit();
  }

  @Override
  public ConnectionMetadata getMetadata() {
    return delegate.getMetadata();
  }

  @Override
  public IsolationLevel getTransactionIsolationLevel() {
    return delegate.getTransactionIsolationLevel();
  }

  @Override
  public Publisher<Void> releaseSavepoint(final String name) {
    return logged("RELEASE SAVEPOINT " + name, delegate.releaseSavepoint(name));
  }

  @Override
  public Publisher<Void> rollbackTransaction() {
    return logged("ROLLBACK", delegate.rollbackTransaction());
  }

  @Override
  public Publisher<Void> rollbackTransactionToSavepoint(final String name) {
    return logged("ROLLBACK TO SAVEPOINT " + name, delegate.rollbackTransactionToSavepoint(name));
  }

  @Override
  public Publisher<Void> setAutoCommit(final boolean autoCommit) {
    return logged("setAutoCommit(" + autoCommit + ")", delegate.setAutoCommit(autoCommit));
  }

  @Override
  public Publisher<Void> setLockWaitTimeout(final Duration timeout) {
    return delegate.setLockWaitTimeout(timeout);
  }

  @Override
  public Publisher<Void> setStatementTimeout(final Duration timeout) {
    return delegate.setStatementTimeout(timeout);
  }

  @Override
  public Publisher<Void> setTransactionIsolationLevel(final IsolationLevel isolationLevel) {
    return delegate.setTransactionIsolationLevel(isolationLevel);
  }

  @Override
  public Publisher<Boolean> validate(final ValidationDepth depth) {
    return delegate.validate(depth);
  }

  @Override
  public String toString() {
    return "Logging[" + delegate + "]";
  }

  private final class LoggingStatement implements Statement, Wrapped<Statement> {

    private final Statement statement;
    private final String sql;

    LoggingStatement(final Statement statement, final String sql) {
      this.statement = statement;
      this.sql = sql;
    }

    @Override
    public Statement unwrap() {
      return statement;
    }

    @Override
    public Statement add() {
      statement.add();
      return this;
    }

    @Override
    public Statement bind(final int index, final Object value) {
      statement.bind(index, value);
      return this;
    }

    @Override
    public Statement bind(final String name, final Object value) {
      statement.bind(name, value);
      return this;
    }

    @Override
    public Statement bindNull(final int index, final Class<?> type) {
      statement.bindNull(index, type);
      return this;
    }

    @Override
    public Statement bindNull(final String name, final Class<?> type) {
      statement.bindNull(name, type);
      return this;
    }

    @Override
    public Statement fetchSize(final int rows) {
      statement.fetchSize(rows);
      return this;
    }

    @Override
    public Statement returnGeneratedValues(final String... columns) {
      statement.returnGeneratedValues(columns);
      return this;
    }

    @Override
    public Publisher<? extends Result> execute() {
      return Flux.defer(
          () -> {
            logger.log(level, "execute: {0}", CatalogStatements.redact(sql));
            return Flux.<Result>from(statement.execute());
          });
    }
  }

  private final class LoggingBatch implements Batch, Wrapped<Batch> {

    private final Batch batch;
    private final List<String> statements = new ArrayList<>();

    LoggingBatch(final Batch batch) {
      this.batch = batch;
    }

    @Override
    public Batch unwrap() {
      return batch;
    }

    @Override
    public Batch add(final String sql) {
      batch.add(sql);
      statements.add(CatalogStatements.redact(sql));
      return this;
    }

    @Override
    public Publisher<? extends Result> execute() {
      return Flux.defer(
          () -> {
            logger.log(level, "batch: {0}", String.join("; ", statements));
            return Flux.<Result>from(batch.execute());
          });
    }
  }
}
