package com.example.pg.toolbox.core.scope;

/**
 * Lifecycle of one session-state scope.
 *
 * <pre>
 * UNENTERED -> ACTIVE -> RESTORED
 * UNENTERED -> ACTIVE -> RESTORED_WITH_ERROR
 * UNENTERED -> FAILED_TO_ENTER
 * </pre>
 */
public enum ScopeState {
  UNENTERED,
  ACTIVE,
  RESTORED,
  RESTORED_WITH_ERROR,
  FAILED_TO_ENTER;

  /** Returns true once the scope can no longer change state. */
  public boolean isTerminal() {
    return this == RESTORED || this == RESTORED_WITH_ERROR || this == FAILED_TO_ENTER;
  }

  /**
   * Checks that moving from this state to {@code next} is a legal transition.
   *
   * @param next the target state
   * @return {@code next}
   * @throws IllegalStateException if the transition is not allowed
   */
  public ScopeState transitionTo(final ScopeState next) {
    final var allowed =
        switch (this) {
          case UNENTERED -> next == ACTIVE || next == FAILED_TO_ENTER;
          case ACTIVE -> next == RESTORED || next == RESTORED_WITH_ERROR;
          case RESTORED, RESTORED_WITH_ERROR, FAILED_TO_ENTER -> false;
        };
    if (!allowed) {
      throw new IllegalStateException("Illegal scope transition " + this + " -> " + next);
    }
    return next;
  }
}
