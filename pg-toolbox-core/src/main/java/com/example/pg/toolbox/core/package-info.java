/**
 * Root package of pg-toolbox.
 *
 * <p>Small helpers around PostgreSQL connections that temporarily change session state and always
 * put it back, for both JDBC and R2DBC.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.pg.toolbox.core.jdbc.SessionScopes} : autocommit and role scopes over a
 *       JDBC {@link java.sql.Connection}, restored by try-with-resources.
 *   <li>{@link com.example.pg.toolbox.core.jdbc.AdvisoryLocks} : advisory lock scopes for JDBC.
 *   <li>{@link com.example.pg.toolbox.core.reactive.R2dbcSessionScopes} : the same scopes for an
 *       R2DBC {@code Connection}, restored on completion, error and cancellation.
 *   <li>{@link com.example.pg.toolbox.core.reactive.R2dbcAdvisoryLocks} : advisory lock scopes for
 *       R2DBC.
 *   <li>{@link com.example.pg.toolbox.core.jdbc.DatabaseObjects} and {@link
 *       com.example.pg.toolbox.core.reactive.R2dbcDatabaseObjects} : existence checks and
 *       idempotent create/drop of databases and roles.
 *   <li>{@link com.example.pg.toolbox.core.cloud.CloudEnvironment} : detection of managed cloud
 *       PostgreSQL offerings.
 *   <li>{@link com.example.pg.toolbox.core.errors.PgToolboxException} : root of the typed
 *       exception hierarchy, with {@link com.example.pg.toolbox.core.errors.ErrorTranslator} for
 *       driver error translation.
 *   <li>{@link com.example.pg.toolbox.core.jdbc.LoggingConnections} and {@link
 *       com.example.pg.toolbox.core.reactive.LoggingConnection} : statement logging wrappers.
 * </ul>
 *
 * <p>A connection must not be shared by two active scopes at the same time: the state they change
 * belongs to the whole session. This is not checked.
 */
package com.example.pg.toolbox.core;
