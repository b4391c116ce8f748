package com.example.pg.toolbox.core.errors;

import io.r2dbc.spi.R2dbcException;
import java.sql.SQLException;
import java.util.Set;

/** PostgreSQL SQLSTATE codes the toolbox cares about, and lookup of a state in a cause chain. */
public final class SqlStates {

  public static final String INVALID_PARAMETER_VALUE = "22023";
  public static final String INVALID_AUTHORIZATION = "28000";
  public static final String INSUFFICIENT_PRIVILEGE = "42501";
  public static final String UNDEFINED_OBJECT = "42704";
  public static final String UNDEFINED_TABLE = "42P01";
  public static final String UNDEFINED_FUNCTION = "42883";
  public static final String INVALID_CATALOG_NAME = "3D000";
  public static final String INVALID_SCHEMA_NAME = "3F000";
  public static final String DUPLICATE_OBJECT = "42710";
  public static final String DUPLICATE_DATABASE = "42P04";
  public static final String DUPLICATE_SCHEMA = "42P06";
  public static final String DUPLICATE_TABLE = "42P07";
  public static final String DUPLICATE_FUNCTION = "42723";
  public static final String LOCK_NOT_AVAILABLE = "55P03";

  static final Set<String> ALREADY_EXISTS =
      Set.of(DUPLICATE_OBJECT, DUPLICATE_DATABASE, DUPLICATE_SCHEMA, DUPLICATE_TABLE,
          DUPLICATE_FUNCTION);

  static final Set<String> DOES_NOT_EXIST =
      Set.of(UNDEFINED_OBJECT, UNDEFINED_TABLE, UNDEFINED_FUNCTION, INVALID_CATALOG_NAME,
          INVALID_SCHEMA_NAME);

  static final Set<String> ROLE =
      Set.of(INVALID_PARAMETER_VALUE, INVALID_AUTHORIZATION, INSUFFICIENT_PRIVILEGE,
          UNDEFINED_OBJECT);

  private SqlStates() {}

  /**
   * Finds the first SQLSTATE in a throwable cause chain. Both JDBC {@link SQLException} (including
   * its chained next exceptions) and R2DBC {@link R2dbcException} are inspected.
   *
   * @param t the throwable to search, may be null
   * @return the first SQLSTATE found, or null if none
   */
  public static String find(final Throwable t) {
    Throwable cur = t;
    while (cur != null) {
      if (cur instanceof SQLException sql) {
        for (SQLException next = sql; next != null; next = next.getNextException()) {
          if (next.getSQLState() != null) return next.getSQLState();
        }
      } else if (cur instanceof R2dbcException r2dbc && r2dbc.getSqlState() != null) {
        return r2dbc.getSqlState();
      }
      if (cur.getCause() == cur) break;
      cur = cur.getCause();
    }
    return null;
  }

  /** Returns true for SQLSTATE class 08, connection exceptions. */
  public static boolean isConnectionException(final String sqlState) {
    return sqlState != null && sqlState.startsWith("08");
  }
}
