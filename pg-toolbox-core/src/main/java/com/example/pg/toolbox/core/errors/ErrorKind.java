package com.example.pg.toolbox.core.errors;

/**
 * Closed set of failure kinds raised by the toolbox. Every {@link PgToolboxException} reports
 * exactly one kind, so callers can branch with a {@code switch} instead of chains of {@code
 * instanceof} checks.
 */
public enum ErrorKind {
  /** The initial session state change failed; the scope never became active. */
  STATE_CHANGE_FAILED,
  /** A role switch targeted a role that does not exist or may not be assumed. */
  ROLE,
  /** A non-blocking advisory lock acquisition found the lock already held. */
  LOCK_UNAVAILABLE,
  /** Restoring session state after a scope failed. */
  RESTORATION_FAILED,
  /** The object being created already exists. */
  ALREADY_EXISTS,
  /** The object being referenced does not exist. */
  DOES_NOT_EXIST
}
