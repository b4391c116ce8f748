package com.example.pg.toolbox.core.errors;

/** The initial attempt to change session state failed, so the scope never became active. */
public class StateChangeFailedException extends PgToolboxException {

  public StateChangeFailedException(final String message, final Throwable cause) {
    this(ErrorKind.STATE_CHANGE_FAILED, message, cause);
  }

  protected StateChangeFailedException(
      final ErrorKind kind, final String message, final Throwable cause) {
    super(kind, message, cause);
  }
}
