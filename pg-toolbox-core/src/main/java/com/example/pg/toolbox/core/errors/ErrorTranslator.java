package com.example.pg.toolbox.core.errors;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps driver errors to the toolbox exception hierarchy.
 *
 * <p>Classification is by SQLSTATE first, found anywhere in the cause chain (see {@link
 * SqlStates#find(Throwable)}). Drivers and pool wrappers that drop the SQLSTATE are handled by a
 * message keyword fallback.
 *
 * <pre>{@code
 * try {
 *   stmt.execute("CREATE ROLE app");
 * } catch (SQLException e) {
 *   throw ErrorTranslator.translate(e, "Role app already exists").orElseThrow(() -> e);
 * }
 * }</pre>
 */
public final class ErrorTranslator {

  private static final String[] ROLE_KEYWORDS = {
    "permission denied to set role", "must be member of role", "role \"",
  };

  private static final String[] ALREADY_EXISTS_KEYWORDS = {"already exists"};

  private static final String[] DOES_NOT_EXIST_KEYWORDS = {"does not exist"};

  private ErrorTranslator() {}

  /**
   * Translates a driver error into {@link AlreadyExistsException} or {@link DoesNotExistException}
   * when it represents one of those conditions.
   *
   * @param error the driver error
   * @param message message for the translated exception
   * @return the translated exception, or empty when the error is of another kind
   */
  public static Optional<PgToolboxException> translate(
      final Throwable error, final String message) {
    if (error instanceof PgToolboxException toolbox) return Optional.of(toolbox);
    if (isAlreadyExists(error)) return Optional.of(new AlreadyExistsException(message, error));
    if (isDoesNotExist(error)) return Optional.of(new DoesNotExistException(message, error));
    return Optional.empty();
  }

  /**
   * Classifies a failed role switch. Authorization failures become {@link RoleException}, anything
   * else (lost connection, server shutdown) a plain {@link StateChangeFailedException}.
   *
   * @param role the role that was being assumed
   * @param error the driver error
   * @return the exception to raise
   */
  public static StateChangeFailedException roleSwitchFailure(
      final String role, final Throwable error) {
    if (SqlStates.isConnectionException(SqlStates.find(error))) {
      return new StateChangeFailedException(
          "Connection lost while switching to role \"" + role + "\"", error);
    }
    if (isRoleError(error)) {
      return new RoleException(role, "Cannot switch to role \"" + role + "\"", error);
    }
    return new StateChangeFailedException("Failed to switch to role \"" + role + "\"", error);
  }

  /** Returns true if the error says the object being created already exists. */
  public static boolean isAlreadyExists(final Throwable error) {
    final var state = SqlStates.find(error);
    if (state != null) return SqlStates.ALREADY_EXISTS.contains(state);
    return messageContains(error, ALREADY_EXISTS_KEYWORDS);
  }

  /** Returns true if the error says the referenced object does not exist. */
  public static boolean isDoesNotExist(final Throwable error) {
    final var state = SqlStates.find(error);
    if (state != null) return SqlStates.DOES_NOT_EXIST.contains(state);
    return messageContains(error, DOES_NOT_EXIST_KEYWORDS);
  }

  /**
   * Returns true if the error is an authorization problem raised by {@code SET ROLE}: unknown role
   * ({@code 22023}), not a member ({@code 42501}), or invalid authorization ({@code 28000}).
   */
  public static boolean isRoleError(final Throwable error) {
    final var state = SqlStates.find(error);
    if (state != null) return SqlStates.ROLE.contains(state);
    return messageContains(error, ROLE_KEYWORDS);
  }

  /** Returns true if the server refused a lock without waiting ({@code 55P03}). */
  public static boolean isLockNotAvailable(final Throwable error) {
    return SqlStates.LOCK_NOT_AVAILABLE.equals(SqlStates.find(error));
  }

  private static boolean messageContains(final Throwable error, final String[] keywords) {
    for (Throwable cur = error; cur != null; cur = cur.getCause()) {
      final var msg = cur.getMessage();
      if (msg != null) {
        final var lower = msg.toLowerCase(Locale.ROOT);
        for (final var keyword : keywords) if (lower.contains(keyword)) return true;
      }
      if (cur.getCause() == cur) break;
    }
    return false;
  }
}
