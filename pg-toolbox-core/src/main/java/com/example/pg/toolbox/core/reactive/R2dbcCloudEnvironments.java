package com.example.pg.toolbox.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.pg.toolbox.core.CatalogStatements;
import com.example.pg.toolbox.core.cloud.CloudEnvironment;
import io.r2dbc.spi.Connection;
import reactor.core.publisher.Mono;

/** Detects the managed PostgreSQL offering behind an R2DBC connection. */
public final class R2dbcCloudEnvironments {

  private static final System.Logger logger =
      System.getLogger(R2dbcCloudEnvironments.class.getName());

  private static final String MARKER_ROLES =
      CatalogStatements.rolesIn(
          CloudEnvironment.markerRoles().size(), R2dbcStatements::placeholder);

  private R2dbcCloudEnvironments() {}

  /**
   * Looks for the provider marker roles in {@code pg_roles}.
   *
   * @param conn open connection
   * @return emits the detected environment, {@link CloudEnvironment#NONE} for a self-hosted server
   */
  public static Mono<CloudEnvironment> detect(final Connection conn) {
    return R2dbcStatements.queryList(
            conn, MARKER_ROLES, String.class, CloudEnvironment.markerRoles().toArray())
        .map(CloudEnvironment::fromMarkerRoles)
        .doOnNext(env -> logger.log(DEBUG, "Detected cloud environment {0}", env));
  }

  /** Emits true if the server is Amazon RDS or Aurora. */
  public static Mono<Boolean> isAwsRds(final Connection conn) {
    return detect(conn).map(env -> env == CloudEnvironment.AWS_RDS);
  }

  /** Emits true if the server is Google Cloud SQL or AlloyDB. */
  public static Mono<Boolean> isGcpCloudSql(final Connection conn) {
    return detect(conn)
        .map(env -> env == CloudEnvironment.GCP_CLOUD_SQL || env == CloudEnvironment.GCP_ALLOYDB);
  }

  /** Emits true if the server is Azure Database for PostgreSQL. */
  public static Mono<Boolean> isAzure(final Connection conn) {
    return detect(conn).map(env -> env == CloudEnvironment.AZURE);
  }
}
