package com.example.pg.toolbox.core.locks;

/** How an advisory lock is acquired. */
public enum LockMode {
  /** {@code pg_advisory_lock}: wait as long as it takes for the lock. */
  BLOCKING("pg_advisory_lock"),
  /**
   * {@code pg_try_advisory_lock}: return at once, failing with {@link
   * com.example.pg.toolbox.core.errors.LockUnavailableException} if the lock is held.
   */
  NON_BLOCKING("pg_try_advisory_lock");

  private final String function;

  LockMode(final String function) {
    this.function = function;
  }

  /** Name of the server function used to acquire the lock. */
  public String function() {
    return function;
  }
}
