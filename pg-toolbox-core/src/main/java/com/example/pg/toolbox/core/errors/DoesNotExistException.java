package com.example.pg.toolbox.core.errors;

/** A statement referenced a database object that does not exist. */
public class DoesNotExistException extends PgToolboxException {

  public DoesNotExistException(final String message, final Throwable cause) {
    super(ErrorKind.DOES_NOT_EXIST, message, cause);
  }
}
