package com.example.pg.toolbox.core.jdbc;

import java.sql.Connection;

/**
 * Unit of work executed against an open {@link Connection} while a session scope is active.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw, typically {@link java.sql.SQLException}
 */
@FunctionalInterface
public interface ConnectionCallback<T, E extends Exception> {
  /**
   * Executes the work with the provided connection.
   *
   * @param conn the connection the scope was opened on
   * @return the work result
   * @throws E on failure
   */
  T execute(final Connection conn) throws E;
}
