package com.example.pg.toolbox.core.reactive;

import static java.lang.System.Logger.Level.INFO;

import com.example.pg.toolbox.core.CatalogStatements;
import com.example.pg.toolbox.core.SqlIdentifiers;
import com.example.pg.toolbox.core.errors.AlreadyExistsException;
import com.example.pg.toolbox.core.errors.DoesNotExistException;
import com.example.pg.toolbox.core.errors.ErrorTranslator;
import io.r2dbc.spi.Connection;
import reactor.core.publisher.Mono;

/**
 * Idempotent creation and removal of databases and roles over R2DBC. Same semantics as {@link
 * com.example.pg.toolbox.core.jdbc.DatabaseObjects}.
 */
public final class R2dbcDatabaseObjects {

  private static final System.Logger logger =
      System.getLogger(R2dbcDatabaseObjects.class.getName());

  private static final String DATABASE_EXISTS = CatalogStatements.databaseExists("$1");
  private static final String ROLE_EXISTS = CatalogStatements.roleExists("$1");

  private R2dbcDatabaseObjects() {}

  /** Emits true if a database with this name exists on the server. */
  public static Mono<Boolean> databaseExists(final Connection conn, final String name) {
    return Mono.fromCallable(() -> SqlIdentifiers.requireName(name, "database name"))
        .flatMap(n -> R2dbcStatements.queryOne(conn, DATABASE_EXISTS, Integer.class, n))
        .hasElement();
  }

  /**
   * Creates a database, with autocommit on for the duration of the statement.
   *
   * @param conn open connection
   * @param name database name
   * @param ignoreExists emit false instead of failing when the database already exists
   * @return emits true if the database was created; fails with {@link AlreadyExistsException}
   */
  public static Mono<Boolean> createDatabase(
      final Connection conn, final String name, final boolean ignoreExists) {
    return Mono.fromCallable(() -> CatalogStatements.createDatabase(name))
        .flatMap(
            sql ->
                R2dbcSessionScopes.withAutocommit(
                    conn, true, c -> runDdl(c, sql, ignoreExists, false, databaseLabel(name))));
  }

  /**
   * Drops a database, with autocommit on for the duration of the statement.
   *
   * @param conn open connection, not connected to the database being dropped
   * @param name database name
   * @param ignoreMissing emit false instead of failing when the database does not exist
   * @return emits true if the database was dropped; fails with {@link DoesNotExistException}
   */
  public static Mono<Boolean> dropDatabase(
      final Connection conn, final String name, final boolean ignoreMissing) {
    return Mono.fromCallable(() -> CatalogStatements.dropDatabase(name))
        .flatMap(
            sql ->
                R2dbcSessionScopes.withAutocommit(
                    conn, true, c -> runDdl(c, sql, false, ignoreMissing, databaseLabel(name))));
  }

  /** Emits true if a role with this name exists on the server. */
  public static Mono<Boolean> roleExists(final Connection conn, final String name) {
    return Mono.fromCallable(() -> SqlIdentifiers.requireName(name, "role name"))
        .flatMap(n -> R2dbcStatements.queryOne(conn, ROLE_EXISTS, Integer.class, n))
        .hasElement();
  }

  /**
   * Creates a role.
   *
   * @param conn open connection
   * @param name role name
   * @param password password, or null for none
   * @param login whether the role may log in
   * @param ignoreExists emit false instead of failing when the role already exists
   * @return emits true if the role was created; fails with {@link AlreadyExistsException}
   */
  public static Mono<Boolean> createRole(
      final Connection conn,
      final String name,
      final String password,
      final boolean login,
      final boolean ignoreExists) {
    return Mono.fromCallable(() -> CatalogStatements.createRole(name, password, login))
        .flatMap(sql -> runDdl(conn, sql, ignoreExists, false, roleLabel(name)));
  }

  /**
   * Drops a role.
   *
   * @param conn open connection
   * @param name role name
   * @param ignoreMissing emit false instead of failing when the role does not exist
   * @return emits true if the role was dropped; fails with {@link DoesNotExistException}
   */
  public static Mono<Boolean> dropRole(
      final Connection conn, final String name, final boolean ignoreMissing) {
    return Mono.fromCallable(() -> CatalogStatements.dropRole(name))
        .flatMap(sql -> runDdl(conn, sql, false, ignoreMissing, roleLabel(name)));
  }

  /** Makes {@code member} a member of {@code role}; fails with {@link DoesNotExistException}. */
  public static Mono<Void> grantRole(
      final Connection conn, final String role, final String member) {
    final var object = roleLabel(role) + " or " + roleLabel(member);
    return Mono.fromCallable(() -> CatalogStatements.grantRole(role, member))
        .flatMap(sql -> runDdl(conn, sql, false, false, object))
        .then();
  }

  /** Emits the name of the role the session currently acts as. */
  public static Mono<String> currentRole(final Connection conn) {
    return R2dbcStatements.queryOne(conn, CatalogStatements.CURRENT_USER, String.class);
  }

  private static Mono<Boolean> runDdl(
      final Connection conn,
      final String sql,
      final boolean ignoreExists,
      final boolean ignoreMissing,
      final String object) {
    return R2dbcStatements.execute(conn, sql)
        .doOnSuccess(v -> logger.log(INFO, "Executed {0}", CatalogStatements.redact(sql)))
        .thenReturn(Boolean.TRUE)
        .onErrorResume(
            e -> {
              if (ErrorTranslator.isAlreadyExists(e)) {
                if (ignoreExists) return Mono.just(Boolean.FALSE);
                return Mono.error(new AlreadyExistsException(object + " already exists", e));
              }
              if (ErrorTranslator.isDoesNotExist(e)) {
                if (ignoreMissing) return Mono.just(Boolean.FALSE);
                return Mono.error(new DoesNotExistException(object + " does not exist", e));
              }
              return Mono.error(e);
            });
  }

  private static String databaseLabel(final String name) {
    return "Database \"" + name + "\"";
  }

  private static String roleLabel(final String name) {
    return "Role \"" + name + "\"";
  }
}
