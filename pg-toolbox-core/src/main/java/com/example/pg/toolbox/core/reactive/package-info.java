/**
 * R2DBC flavor for {@link io.r2dbc.spi.Connection}, built on Project Reactor. Scopes are cold
 * publishers: each subscription enters, runs the body and restores, and a Reactive Streams {@code
 * cancel} is the cancellation signal.
 *
 * <p>Entry points: {@link com.example.pg.toolbox.core.reactive.R2dbcSessionScopes}, {@link
 * com.example.pg.toolbox.core.reactive.R2dbcAdvisoryLocks}, {@link
 * com.example.pg.toolbox.core.reactive.R2dbcDatabaseObjects}, {@link
 * com.example.pg.toolbox.core.reactive.R2dbcCloudEnvironments} and {@link
 * com.example.pg.toolbox.core.reactive.LoggingConnection}.
 */
package com.example.pg.toolbox.core.reactive;
