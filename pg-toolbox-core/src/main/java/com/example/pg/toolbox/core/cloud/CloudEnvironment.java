package com.example.pg.toolbox.core.cloud;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Managed PostgreSQL offering a connection is talking to.
 *
 * <p>Detection against a live server looks for the administrative role each provider creates in
 * every instance (see {@link #markerRole()}). {@link #fromHost(String)} is an offline heuristic on
 * the endpoint name for when no connection is at hand.
 */
public enum CloudEnvironment {
  AWS_RDS("rds_superuser"),
  GCP_CLOUD_SQL("cloudsqlsuperuser"),
  GCP_ALLOYDB("alloydbsuperuser"),
  AZURE("azure_pg_admin"),
  NONE(null);

  // Instance: <instance-name>.<xyz>.<aws-region>.rds.amazonaws.com
  // Cluster:  <cluster-name>.cluster-<xyz>.<aws-region>.rds.amazonaws.com
  // China:    <instance-name>.<xyz>.rds.<aws-region>.amazonaws.com.cn
  private static final Pattern RDS_HOST_PATTERN =
      Pattern.compile(
          "^.+\\.[a-z0-9\\-]+\\."
              + "(rds\\.[a-z0-9\\-]+\\.amazonaws\\.com\\.cn"
              + "|[a-z0-9\\-]+\\.rds\\.amazonaws\\.com(\\.cn)?)\\.?$",
          Pattern.CASE_INSENSITIVE);

  // <server-name>.postgres.database.azure.com (flexible and single server)
  private static final Pattern AZURE_HOST_PATTERN =
      Pattern.compile(
          "^[a-z0-9\\-]+\\.postgres\\.database\\.azure\\.com\\.?$", Pattern.CASE_INSENSITIVE);

  private static final Pattern ALLOYDB_HOST_PATTERN =
      Pattern.compile("^.+\\.alloydb\\.goog\\.?$", Pattern.CASE_INSENSITIVE);

  private final String markerRole;

  CloudEnvironment(final String markerRole) {
    this.markerRole = markerRole;
  }

  /**
   * Administrative role present on every server of this provider, or null for {@link #NONE}.
   *
   * @return marker role name
   */
  public String markerRole() {
    return markerRole;
  }

  /** Marker roles of all providers, in detection order. */
  public static List<String> markerRoles() {
    return List.of(
        AWS_RDS.markerRole, GCP_CLOUD_SQL.markerRole, GCP_ALLOYDB.markerRole, AZURE.markerRole);
  }

  /**
   * Resolves the environment from the marker roles found on a server. When several are present
   * (a self-hosted server with a copied role, say) the first in {@link #markerRoles()} order wins.
   *
   * @param rolesPresent role names found on the server
   * @return the detected environment, {@link #NONE} if no marker role is present
   */
  public static CloudEnvironment fromMarkerRoles(final Collection<String> rolesPresent) {
    for (final var env : values()) {
      if (env.markerRole != null && rolesPresent.contains(env.markerRole)) return env;
    }
    return NONE;
  }

  /**
   * Guesses the environment from an endpoint host name. Cloud SQL endpoints are plain IP
   * addresses and cannot be recognised this way.
   *
   * @param host host name, may be null
   * @return the guessed environment, {@link #NONE} if unknown
   */
  public static CloudEnvironment fromHost(final String host) {
    return Optional.ofNullable(host)
        .map(String::trim)
        .map(h -> h.toLowerCase(Locale.ROOT))
        .filter(h -> !h.isEmpty())
        .map(
            h -> {
              if (RDS_HOST_PATTERN.matcher(h).matches()) return AWS_RDS;
              if (AZURE_HOST_PATTERN.matcher(h).matches()) return AZURE;
              if (ALLOYDB_HOST_PATTERN.matcher(h).matches()) return GCP_ALLOYDB;
              return NONE;
            })
        .orElse(NONE);
  }

  /** Returns true for any managed offering. */
  public boolean isCloud() {
    return this != NONE;
  }
}
