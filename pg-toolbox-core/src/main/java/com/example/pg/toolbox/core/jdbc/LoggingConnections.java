package com.example.pg.toolbox.core.jdbc;

import com.example.pg.toolbox.core.CatalogStatements;
import com.example.pg.toolbox.core.ToolboxSettings;
import java.sql.Connection;
import java.util.Objects;

/**
 * Wraps a JDBC connection so that the SQL it runs is written to the log.
 *
 * <p>Logged: statement text passed to {@code prepareStatement}, {@code prepareCall} and {@code
 * nativeSQL}; statement text passed to {@code execute*} and {@code addBatch} of statements created
 * through the wrapper; autocommit changes, commits and rollbacks. Role passwords are masked.
 * Everything else is delegated unchanged, including the exceptions the driver throws.
 *
 * <pre>{@code
 * Connection conn = LoggingConnections.wrap(dataSource.getConnection());
 * }</pre>
 */
public final class LoggingConnections {

  private static final System.Logger logger = System.getLogger(LoggingConnections.class.getName());

  private LoggingConnections() {}

  /**
   * Wraps a connection, logging at the configured level (see {@link
   * ToolboxSettings#statementLogLevel()}).
   *
   * @param conn connection to wrap
   * @return the logging connection
   */
  public static Connection wrap(final Connection conn) {
    return wrap(conn, ToolboxSettings.statementLogLevel());
  }

  /**
   * Wraps a connection, logging at the given level.
   *
   * @param conn connection to wrap
   * @param level log level for statements
   * @return the logging connection
   */
  public static Connection wrap(final Connection conn, final System.Logger.Level level) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(level, "level");
    if (conn instanceof LoggingJdbcConnection) return conn;
    return new LoggingJdbcConnection(conn, level);
  }

  static void logSql(final System.Logger.Level level, final String call, final String sql) {
    if (logger.isLoggable(level)) {
      logger.log(level, "{0}: {1}", call, sql == null ? null : CatalogStatements.redact(sql));
    }
  }

  static void log(final System.Logger.Level level, final String message) {
    logger.log(level, message);
  }
}
