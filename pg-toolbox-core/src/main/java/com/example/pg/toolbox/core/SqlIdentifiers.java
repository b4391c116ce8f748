package com.example.pg.toolbox.core;

import java.util.Objects;

/**
 * Quoting of identifiers and literals for the few statements that cannot take bind parameters
 * ({@code SET ROLE}, {@code CREATE DATABASE}, {@code CREATE ROLE ... PASSWORD}).
 */
public final class SqlIdentifiers {

  private SqlIdentifiers() {}

  /**
   * Quotes a PostgreSQL identifier, doubling embedded double quotes.
   *
   * <pre>{@code
   * SqlIdentifiers.quote("app_reader");   // "app_reader"
   * SqlIdentifiers.quote("we\"ird");      // "we""ird"
   * }</pre>
   *
   * @param identifier role, database or other object name
   * @return the quoted identifier
   * @throws IllegalArgumentException if the identifier is blank or contains a NUL character
   */
  public static String quote(final String identifier) {
    requireName(identifier, "identifier");
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  /**
   * Quotes a string literal for use with {@code standard_conforming_strings = on}, the server
   * default since PostgreSQL 9.1.
   *
   * @param value the literal value
   * @return the quoted literal
   */
  public static String literal(final String value) {
    Objects.requireNonNull(value, "value");
    if (value.indexOf('\0') >= 0)
      throw new IllegalArgumentException("literal must not contain NUL characters");
    return '\'' + value.replace("'", "''") + '\'';
  }

  /**
   * Validates an object name argument.
   *
   * @param name the name to check
   * @param what what the name denotes, used in the error message
   * @return the name
   */
  public static String requireName(final String name, final String what) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException(what + " is required");
    if (name.indexOf('\0') >= 0)
      throw new IllegalArgumentException(what + " must not contain NUL characters");
    return name;
  }
}
