package com.example.pg.toolbox.core.reactive;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.Result;
import io.r2dbc.spi.Statement;
import java.util.List;
import java.util.Optional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Minimal statement helpers used by the R2DBC scopes and catalog helpers. Bind markers follow the
 * PostgreSQL driver: {@code $1}, {@code $2}, ...
 */
public final class R2dbcStatements {

  private R2dbcStatements() {}

  /** Bind marker for the zero-based parameter index, {@code $1} for index 0. */
  public static String placeholder(final int index) {
    return "$" + (index + 1);
  }

  /**
   * Executes a statement, discarding any rows. Works for functions returning {@code void}, whose
   * values are never decoded.
   *
   * @param conn open connection
   * @param sql statement text
   * @param params values bound to {@code $1}, {@code $2}, ... in order
   * @return completes when the statement has run
   */
  public static Mono<Void> execute(
      final Connection conn, final String sql, final Object... params) {
    return results(conn, sql, params).concatMap(Result::getRowsUpdated).then();
  }

  /**
   * Runs a query and emits the first column of the first row.
   *
   * @param conn open connection
   * @param sql query text
   * @param type expected column type
   * @param params values bound to {@code $1}, {@code $2}, ... in order
   * @param <T> column type
   * @return the value, empty if the query returned no rows or a SQL NULL
   */
  public static <T> Mono<T> queryOne(
      final Connection conn, final String sql, final Class<T> type, final Object... params) {
    // all rows are read so the result is fully consumed before the connection is reused
    return values(conn, sql, type, params)
        .collectList()
        .flatMap(rows -> rows.isEmpty() ? Mono.<T>empty() : Mono.justOrEmpty(rows.get(0)));
  }

  /**
   * Runs a query and emits the first column of every non-null row value.
   *
   * @param conn open connection
   * @param sql query text
   * @param type expected column type
   * @param params values bound to {@code $1}, {@code $2}, ... in order
   * @param <T> column type
   * @return the values in row order
   */
  public static <T> Mono<List<T>> queryList(
      final Connection conn, final String sql, final Class<T> type, final Object... params) {
    return values(conn, sql, type, params)
        .filter(Optional::isPresent)
        .map(Optional::get)
        .collectList();
  }

  private static <T> Flux<Optional<T>> values(
      final Connection conn, final String sql, final Class<T> type, final Object... params) {
    return results(conn, sql, params)
        .concatMap(result -> result.map((row, md) -> Optional.ofNullable(row.get(0, type))));
  }

  private static Flux<Result> results(
      final Connection conn, final String sql, final Object... params) {
    return Flux.defer(() -> Flux.<Result>from(bind(conn.createStatement(sql), params).execute()));
  }

  private static Statement bind(final Statement stmt, final Object... params) {
    for (int i = 0; i < params.length; i++) stmt.bind(i, params[i]);
    return stmt;
  }
}
