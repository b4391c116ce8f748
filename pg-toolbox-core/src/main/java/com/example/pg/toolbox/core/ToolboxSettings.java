package com.example.pg.toolbox.core;

import com.example.pg.toolbox.core.locks.LockMode;
import java.lang.System.Logger.Level;
import java.util.Locale;
import java.util.Optional;

/**
 * Library-wide defaults, resolved on each call so tests and applications can change them at
 * runtime.
 *
 * <p>Configuration can be supplied via system properties or environment variables, system
 * properties taking precedence:
 *
 * <ul>
 *   <li>pgtoolbox.lock.mode / PGTOOLBOX_LOCK_MODE: {@code BLOCKING} (default) or {@code
 *       NON_BLOCKING}
 *   <li>pgtoolbox.statement.log.level / PGTOOLBOX_STATEMENT_LOG_LEVEL: a {@link Level} name used
 *       by the logging connection wrappers (default {@code DEBUG})
 * </ul>
 *
 * <p>Unparseable values are ignored and the default applies.
 */
public final class ToolboxSettings {

  public static final String LOCK_MODE_PROPERTY = "pgtoolbox.lock.mode";
  public static final String LOCK_MODE_ENV = "PGTOOLBOX_LOCK_MODE";
  public static final String STATEMENT_LOG_LEVEL_PROPERTY = "pgtoolbox.statement.log.level";
  public static final String STATEMENT_LOG_LEVEL_ENV = "PGTOOLBOX_STATEMENT_LOG_LEVEL";

  private ToolboxSettings() {}

  /**
   * Lock mode used by the advisory lock helpers when the caller does not pass one.
   *
   * @return configured lock mode, {@link LockMode#BLOCKING} by default
   */
  public static LockMode defaultLockMode() {
    return setting(LOCK_MODE_PROPERTY, LOCK_MODE_ENV)
        .flatMap(val -> parse(LockMode.class, val))
        .orElse(LockMode.BLOCKING);
  }

  /**
   * Level at which the logging connection wrappers report statements.
   *
   * @return configured level, {@link Level#DEBUG} by default
   */
  public static Level statementLogLevel() {
    return setting(STATEMENT_LOG_LEVEL_PROPERTY, STATEMENT_LOG_LEVEL_ENV)
        .flatMap(val -> parse(Level.class, val))
        .orElse(Level.DEBUG);
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim);
  }

  private static <E extends Enum<E>> Optional<E> parse(final Class<E> type, final String value) {
    try {
      return Optional.of(Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace('-', '_')));
    } catch (final IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
