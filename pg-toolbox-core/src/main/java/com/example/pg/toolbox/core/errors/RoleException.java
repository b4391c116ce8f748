package com.example.pg.toolbox.core.errors;

/**
 * A role switch failed because the target role does not exist or the session user is not allowed
 * to assume it. Raised instead of a plain {@link StateChangeFailedException} so that
 * authorization problems can be told apart from lost connections.
 */
public class RoleException extends StateChangeFailedException {

  private final String role;

  public RoleException(final String role, final String message, final Throwable cause) {
    super(ErrorKind.ROLE, message, cause);
    this.role = role;
  }

  /** The role that could not be assumed. */
  public String role() {
    return role;
  }
}
