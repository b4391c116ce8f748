package com.example.pg.toolbox.core;

import java.util.function.IntFunction;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Text of the catalog statements shared by the JDBC and R2DBC helpers. Object names cannot be
 * bound as parameters in DDL, so they are quoted with {@link SqlIdentifiers}.
 */
public final class CatalogStatements {

  public static final String CURRENT_USER = "SELECT current_user";

  private static final String PASSWORD = " PASSWORD ";

  private static final Pattern PASSWORD_CLAUSE =
      Pattern.compile("(\\sPASSWORD\\s+).+", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private CatalogStatements() {}

  /** Existence check on {@code pg_database}, with the bind marker for the name. */
  public static String databaseExists(final String placeholder) {
    return "SELECT 1 FROM pg_database WHERE datname = " + placeholder;
  }

  /** Existence check on {@code pg_roles}, with the bind marker for the name. */
  public static String roleExists(final String placeholder) {
    return "SELECT 1 FROM pg_roles WHERE rolname = " + placeholder;
  }

  /**
   * Lookup of the names among {@code count} candidates that exist in {@code pg_roles}.
   *
   * @param count number of candidate names
   * @param placeholder driver-specific bind marker for the zero-based parameter index
   * @return the query text
   */
  public static String rolesIn(final int count, final IntFunction<String> placeholder) {
    return IntStream.range(0, count)
        .mapToObj(placeholder)
        .collect(Collectors.joining(", ", "SELECT rolname FROM pg_roles WHERE rolname IN (", ")"));
  }

  public static String createDatabase(final String name) {
    return "CREATE DATABASE " + SqlIdentifiers.quote(name);
  }

  public static String dropDatabase(final String name) {
    return "DROP DATABASE " + SqlIdentifiers.quote(name);
  }

  public static String createRole(final String name, final String password, final boolean login) {
    final var sql = new StringBuilder("CREATE ROLE ").append(SqlIdentifiers.quote(name));
    if (login) sql.append(" LOGIN");
    if (password != null) sql.append(PASSWORD).append(SqlIdentifiers.literal(password));
    return sql.toString();
  }

  public static String dropRole(final String name) {
    return "DROP ROLE " + SqlIdentifiers.quote(name);
  }

  public static String grantRole(final String role, final String member) {
    return "GRANT " + SqlIdentifiers.quote(role) + " TO " + SqlIdentifiers.quote(member);
  }

  public static String setRole(final String role) {
    return "SET ROLE " + SqlIdentifiers.quote(role);
  }

  /**
   * Masks the password literal of a {@code CREATE ROLE} or {@code ALTER ROLE} statement for
   * logging. Everything from the literal to the end of the statement is dropped.
   *
   * @param sql statement text
   * @return the text with any password literal replaced
   */
  public static String redact(final String sql) {
    return PASSWORD_CLAUSE.matcher(sql).replaceFirst("$1****");
  }
}
