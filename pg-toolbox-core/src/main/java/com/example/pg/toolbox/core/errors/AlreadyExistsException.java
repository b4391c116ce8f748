package com.example.pg.toolbox.core.errors;

/** Creating a database object failed because an object with that name already exists. */
public class AlreadyExistsException extends PgToolboxException {

  public AlreadyExistsException(final String message, final Throwable cause) {
    super(ErrorKind.ALREADY_EXISTS, message, cause);
  }
}
