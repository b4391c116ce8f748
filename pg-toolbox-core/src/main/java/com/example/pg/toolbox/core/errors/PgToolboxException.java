package com.example.pg.toolbox.core.errors;

import java.util.Objects;

/**
 * Base type of every exception raised by the toolbox itself.
 *
 * <p>Driver failures are never swallowed: the originating {@link java.sql.SQLException} or {@link
 * io.r2dbc.spi.R2dbcException} is always available as the cause.
 */
public class PgToolboxException extends RuntimeException {

  private final ErrorKind kind;

  protected PgToolboxException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the kind of failure this exception represents.
   *
   * @return the failure kind, never null
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the SQLSTATE of the underlying driver error, if one is present in the cause chain.
   *
   * @return the SQLSTATE or null
   */
  public String sqlState() {
    return SqlStates.find(getCause());
  }
}
