package com.example.pg.toolbox.core.errors;

import com.example.pg.toolbox.core.locks.AdvisoryLockKey;

/** A non-blocking advisory lock acquisition found the lock already held by another session. */
public class LockUnavailableException extends StateChangeFailedException {

  private final AdvisoryLockKey key;

  public LockUnavailableException(final AdvisoryLockKey key, final Throwable cause) {
    super(
        ErrorKind.LOCK_UNAVAILABLE, "Advisory lock " + key + " is held by another session", cause);
    this.key = key;
  }

  /** The key of the lock that could not be acquired. */
  public AdvisoryLockKey key() {
    return key;
  }
}
