/**
 * Blocking flavor for {@link java.sql.Connection}: scopes are {@link AutoCloseable} guards meant
 * for try-with-resources, and thread interruption is the cancellation signal.
 *
 * <p>Entry points: {@link com.example.pg.toolbox.core.jdbc.SessionScopes} (autocommit, role and
 * caller-defined changes), {@link com.example.pg.toolbox.core.jdbc.AdvisoryLocks}, {@link
 * com.example.pg.toolbox.core.jdbc.DatabaseObjects}, {@link
 * com.example.pg.toolbox.core.jdbc.CloudEnvironments} and {@link
 * com.example.pg.toolbox.core.jdbc.LoggingConnections}.
 */
package com.example.pg.toolbox.core.jdbc;
