package com.example.pg.toolbox.core.errors;

/**
 * Restoring session state at the end of a scope failed.
 *
 * <p>When the scope body completed normally this exception is thrown on its own. When the body
 * failed too, the body's exception is the one that propagates and this exception is attached to
 * it through {@link Throwable#addSuppressed(Throwable)}.
 */
public class RestorationFailedException extends PgToolboxException {

  public RestorationFailedException(final String message, final Throwable cause) {
    super(ErrorKind.RESTORATION_FAILED, message, cause);
  }
}
