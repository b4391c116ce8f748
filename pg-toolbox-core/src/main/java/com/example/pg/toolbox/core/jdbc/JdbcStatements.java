package com.example.pg.toolbox.core.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Minimal statement helpers used by the JDBC scopes and catalog helpers. */
public final class JdbcStatements {

  private JdbcStatements() {}

  /**
   * Executes a statement without parameters, discarding any result.
   *
   * @param conn open connection
   * @param sql statement text
   * @throws SQLException on database errors
   */
  public static void execute(final Connection conn, final String sql) throws SQLException {
    try (final var stmt = conn.createStatement()) {
      stmt.execute(sql);
    }
  }

  /**
   * Runs a query with bound parameters, discarding its rows. For functions returning {@code void}.
   *
   * @param conn open connection
   * @param sql query text with {@code ?} placeholders
   * @param params values bound to the placeholders in order
   * @throws SQLException on database errors
   */
  public static void executeQuery(final Connection conn, final String sql, final Object... params)
      throws SQLException {
    try (final var stmt = prepare(conn, sql, params);
        final var rs = stmt.executeQuery()) {
      while (rs.next()) {
        // drain
      }
    }
  }

  /**
   * Runs a query and returns the first column of the first row.
   *
   * @param conn open connection
   * @param sql query text with {@code ?} placeholders
   * @param type expected column type
   * @param params values bound to the placeholders in order
   * @param <T> column type
   * @return the value, or null if the query returned no rows or a SQL NULL
   * @throws SQLException on database errors
   */
  public static <T> T queryOne(
      final Connection conn, final String sql, final Class<T> type, final Object... params)
      throws SQLException {
    try (final var stmt = prepare(conn, sql, params);
        final var rs = stmt.executeQuery()) {
      return rs.next() ? rs.getObject(1, type) : null;
    }
  }

  /**
   * Runs a query and returns the first column of every row.
   *
   * @param conn open connection
   * @param sql query text with {@code ?} placeholders
   * @param type expected column type
   * @param params values bound to the placeholders in order
   * @param <T> column type
   * @return the values in row order
   * @throws SQLException on database errors
   */
  public static <T> List<T> queryList(
      final Connection conn, final String sql, final Class<T> type, final Object... params)
      throws SQLException {
    try (final var stmt = prepare(conn, sql, params);
        final var rs = stmt.executeQuery()) {
      final var values = new ArrayList<T>();
      while (rs.next()) values.add(rs.getObject(1, type));
      return values;
    }
  }

  private static PreparedStatement prepare(
      final Connection conn, final String sql, final Object... params) throws SQLException {
    final var stmt = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) stmt.setObject(i + 1, params[i]);
      return stmt;
    } catch (final SQLException e) {
      try {
        stmt.close();
      } catch (final SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }
}
