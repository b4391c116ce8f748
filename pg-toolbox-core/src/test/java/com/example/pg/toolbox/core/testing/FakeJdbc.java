package com.example.pg.toolbox.core.testing;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/** Mockito-backed JDBC {@link Connection} answering from a {@link FakePostgres} session. */
public final class FakeJdbc {

  private FakeJdbc() {}

  public static Connection connect(final FakePostgres.Session session) throws SQLException {
    final var conn = mock(Connection.class);
    when(conn.getAutoCommit()).thenAnswer(inv -> session.autocommit());
    doAnswer(
            inv -> {
              call(() -> session.setAutocommit(inv.getArgument(0)));
              return null;
            })
        .when(conn)
        .setAutoCommit(anyBoolean());
    when(conn.createStatement()).thenAnswer(inv -> statement(session));
    when(conn.prepareStatement(anyString()))
        .thenAnswer(inv -> prepared(session, inv.getArgument(0)));
    return conn;
  }

  private static Statement statement(final FakePostgres.Session session) throws SQLException {
    final var stmt = mock(Statement.class);
    when(stmt.execute(anyString()))
        .thenAnswer(
            inv -> !await(session.submit(inv.getArgument(0), List.of())).values().isEmpty());
    return stmt;
  }

  private static PreparedStatement prepared(final FakePostgres.Session session, final String sql)
      throws SQLException {
    final var stmt = mock(PreparedStatement.class);
    final Map<Integer, Object> params = new TreeMap<>();
    doAnswer(
            inv -> {
              params.put(inv.getArgument(0), inv.getArgument(1));
              return null;
            })
        .when(stmt)
        .setObject(anyInt(), any());
    when(stmt.executeQuery())
        .thenAnswer(inv -> resultSet(await(session.submit(sql, new ArrayList<>(params.values())))));
    return stmt;
  }

  @SuppressWarnings("unchecked")
  private static ResultSet resultSet(final FakePostgres.Result result) throws SQLException {
    final var rs = mock(ResultSet.class);
    final var row = new AtomicInteger(-1);
    final var values = result.values();
    when(rs.next()).thenAnswer(inv -> row.incrementAndGet() < values.size());
    when(rs.getObject(eq(1), any(Class.class)))
        .thenAnswer(
            inv -> {
              final Class<Object> type = inv.getArgument(1);
              final var value = values.get(row.get());
              return value == null ? null : type.cast(value);
            });
    return rs;
  }

  private static FakePostgres.Result await(final CompletableFuture<FakePostgres.Result> future)
      throws SQLException {
    try {
      return future.get();
    } catch (final InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new SQLException("canceling statement due to user request", "57014", e);
    } catch (final ExecutionException e) {
      throw translate(e.getCause());
    }
  }

  private static void call(final Runnable action) throws SQLException {
    try {
      action.run();
    } catch (final FakePostgres.ServerError e) {
      throw translate(e);
    }
  }

  static SQLException translate(final Throwable error) {
    if (error instanceof FakePostgres.ServerError server) {
      if (server.sqlState().startsWith("08")) {
        return new SQLTransientConnectionException(server.getMessage(), server.sqlState());
      }
      return new SQLException(server.getMessage(), server.sqlState());
    }
    return new SQLException(error);
  }
}
