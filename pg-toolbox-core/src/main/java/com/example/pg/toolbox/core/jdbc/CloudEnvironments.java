package com.example.pg.toolbox.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.pg.toolbox.core.CatalogStatements;
import com.example.pg.toolbox.core.cloud.CloudEnvironment;
import java.sql.Connection;
import java.sql.SQLException;

/** Detects the managed PostgreSQL offering behind a JDBC connection. */
public final class CloudEnvironments {

  private static final System.Logger logger = System.getLogger(CloudEnvironments.class.getName());

  private static final String MARKER_ROLES =
      CatalogStatements.rolesIn(CloudEnvironment.markerRoles().size(), i -> "?");

  private CloudEnvironments() {}

  /**
   * Looks for the provider marker roles in {@code pg_roles}.
   *
   * @param conn open connection
   * @return the detected environment, {@link CloudEnvironment#NONE} for a self-hosted server
   * @throws SQLException on database errors
   */
  public static CloudEnvironment detect(final Connection conn) throws SQLException {
    final var present =
        JdbcStatements.queryList(
            conn, MARKER_ROLES, String.class, CloudEnvironment.markerRoles().toArray());
    final var env = CloudEnvironment.fromMarkerRoles(present);
    logger.log(DEBUG, "Detected cloud environment {0}", env);
    return env;
  }

  /** Returns true if the server is Amazon RDS or Aurora. */
  public static boolean isAwsRds(final Connection conn) throws SQLException {
    return detect(conn) == CloudEnvironment.AWS_RDS;
  }

  /** Returns true if the server is Google Cloud SQL or AlloyDB. */
  public static boolean isGcpCloudSql(final Connection conn) throws SQLException {
    final var env = detect(conn);
    return env == CloudEnvironment.GCP_CLOUD_SQL || env == CloudEnvironment.GCP_ALLOYDB;
  }

  /** Returns true if the server is Azure Database for PostgreSQL. */
  public static boolean isAzure(final Connection conn) throws SQLException {
    return detect(conn) == CloudEnvironment.AZURE;
  }
}
