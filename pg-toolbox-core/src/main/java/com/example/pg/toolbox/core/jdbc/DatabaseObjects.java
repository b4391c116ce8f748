package com.example.pg.toolbox.core.jdbc;

import static java.lang.System.Logger.Level.INFO;

import com.example.pg.toolbox.core.CatalogStatements;
import com.example.pg.toolbox.core.SqlIdentifiers;
import com.example.pg.toolbox.core.errors.AlreadyExistsException;
import com.example.pg.toolbox.core.errors.DoesNotExistException;
import com.example.pg.toolbox.core.errors.ErrorTranslator;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Idempotent creation and removal of databases and roles.
 *
 * <p>Duplicate and missing objects are reported as {@link AlreadyExistsException} and {@link
 * DoesNotExistException} unless the caller asks for them to be ignored. Any other driver failure
 * is thrown as the original {@link SQLException}.
 */
public final class DatabaseObjects {

  private static final System.Logger logger = System.getLogger(DatabaseObjects.class.getName());

  private static final String DATABASE_EXISTS = CatalogStatements.databaseExists("?");
  private static final String ROLE_EXISTS = CatalogStatements.roleExists("?");

  private DatabaseObjects() {}

  /** Returns true if a database with this name exists on the server. */
  public static boolean databaseExists(final Connection conn, final String name)
      throws SQLException {
    SqlIdentifiers.requireName(name, "database name");
    return JdbcStatements.queryOne(conn, DATABASE_EXISTS, Integer.class, name) != null;
  }

  /**
   * Creates a database. {@code CREATE DATABASE} cannot run inside a transaction block, so the
   * statement runs with autocommit on, and the previous autocommit setting is restored afterwards.
   *
   * @param conn open connection
   * @param name database name
   * @param ignoreExists return false instead of failing when the database already exists
   * @return true if the database was created
   * @throws AlreadyExistsException if the database exists and {@code ignoreExists} is false
   * @throws SQLException on any other database error
   */
  public static boolean createDatabase(
      final Connection conn, final String name, final boolean ignoreExists) throws SQLException {
    final var sql = CatalogStatements.createDatabase(name);
    return SessionScopes.withAutocommit(
        conn, true, c -> runDdl(c, sql, ignoreExists, false, "Database \"" + name + "\""));
  }

  /**
   * Drops a database, with autocommit on for the duration of the statement.
   *
   * @param conn open connection, not connected to the database being dropped
   * @param name database name
   * @param ignoreMissing return false instead of failing when the database does not exist
   * @return true if the database was dropped
   * @throws DoesNotExistException if the database is missing and {@code ignoreMissing} is false
   * @throws SQLException on any other database error
   */
  public static boolean dropDatabase(
      final Connection conn, final String name, final boolean ignoreMissing) throws SQLException {
    final var sql = CatalogStatements.dropDatabase(name);
    return SessionScopes.withAutocommit(
        conn, true, c -> runDdl(c, sql, false, ignoreMissing, "Database \"" + name + "\""));
  }

  /** Returns true if a role with this name exists on the server. */
  public static boolean roleExists(final Connection conn, final String name) throws SQLException {
    SqlIdentifiers.requireName(name, "role name");
    return JdbcStatements.queryOne(conn, ROLE_EXISTS, Integer.class, name) != null;
  }

  /**
   * Creates a role.
   *
   * @param conn open connection
   * @param name role name
   * @param password password, or null for none
   * @param login whether the role may log in
   * @param ignoreExists return false instead of failing when the role already exists
   * @return true if the role was created
   * @throws AlreadyExistsException if the role exists and {@code ignoreExists} is false
   * @throws SQLException on any other database error
   */
  public static boolean createRole(
      final Connection conn,
      final String name,
      final String password,
      final boolean login,
      final boolean ignoreExists)
      throws SQLException {
    final var sql = CatalogStatements.createRole(name, password, login);
    return runDdl(conn, sql, ignoreExists, false, "Role \"" + name + "\"");
  }

  /**
   * Drops a role.
   *
   * @param conn open connection
   * @param name role name
   * @param ignoreMissing return false instead of failing when the role does not exist
   * @return true if the role was dropped
   * @throws DoesNotExistException if the role is missing and {@code ignoreMissing} is false
   * @throws SQLException on any other database error
   */
  public static boolean dropRole(
      final Connection conn, final String name, final boolean ignoreMissing) throws SQLException {
    final var sql = CatalogStatements.dropRole(name);
    return runDdl(conn, sql, false, ignoreMissing, "Role \"" + name + "\"");
  }

  /**
   * Makes {@code member} a member of {@code role}.
   *
   * @throws DoesNotExistException if either role does not exist
   * @throws SQLException on any other database error
   */
  public static void grantRole(final Connection conn, final String role, final String member)
      throws SQLException {
    final var sql = CatalogStatements.grantRole(role, member);
    runDdl(conn, sql, false, false, "Role \"" + role + "\" or \"" + member + "\"");
  }

  /** Returns the name of the role the session currently acts as. */
  public static String currentRole(final Connection conn) throws SQLException {
    return JdbcStatements.queryOne(conn, CatalogStatements.CURRENT_USER, String.class);
  }

  private static boolean runDdl(
      final Connection conn,
      final String sql,
      final boolean ignoreExists,
      final boolean ignoreMissing,
      final String object)
      throws SQLException {
    try {
      JdbcStatements.execute(conn, sql);
    } catch (final SQLException e) {
      if (ErrorTranslator.isAlreadyExists(e)) {
        if (ignoreExists) return false;
        throw new AlreadyExistsException(object + " already exists", e);
      }
      if (ErrorTranslator.isDoesNotExist(e)) {
        if (ignoreMissing) return false;
        throw new DoesNotExistException(object + " does not exist", e);
      }
      throw e;
    }
    logger.log(INFO, "Executed {0}", CatalogStatements.redact(sql));
    return true;
  }
}
