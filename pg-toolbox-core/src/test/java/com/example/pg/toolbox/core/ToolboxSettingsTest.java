package com.example.pg.toolbox.core;

import static org.junit.jupiter.api.Assertions.*;

import com.example.pg.toolbox.core.locks.LockMode;
import org.junit.jupiter.api.*;

class ToolboxSettingsTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty(ToolboxSettings.LOCK_MODE_PROPERTY);
    System.clearProperty(ToolboxSettings.STATEMENT_LOG_LEVEL_PROPERTY);
  }

  @Test
  @DisplayName("Should default to blocking locks and DEBUG statement logging")
  void shouldUseDefaults() {
    assumeNoEnvironmentOverrides();
    assertEquals(LockMode.BLOCKING, ToolboxSettings.defaultLockMode());
    assertEquals(System.Logger.Level.DEBUG, ToolboxSettings.statementLogLevel());
  }

  @Test
  @DisplayName("System properties are parsed case-insensitively")
  void shouldReadSystemProperties() {
    System.setProperty(ToolboxSettings.LOCK_MODE_PROPERTY, "non-blocking");
    System.setProperty(ToolboxSettings.STATEMENT_LOG_LEVEL_PROPERTY, " info ");
    assertEquals(LockMode.NON_BLOCKING, ToolboxSettings.defaultLockMode());
    assertEquals(System.Logger.Level.INFO, ToolboxSettings.statementLogLevel());
  }

  @Test
  @DisplayName("Invalid values fall back to the default")
  void shouldIgnoreInvalidValues() {
    assumeNoEnvironmentOverrides();
    System.setProperty(ToolboxSettings.LOCK_MODE_PROPERTY, "sometimes");
    System.setProperty(ToolboxSettings.STATEMENT_LOG_LEVEL_PROPERTY, "LOUD");
    assertEquals(LockMode.BLOCKING, ToolboxSettings.defaultLockMode());
    assertEquals(System.Logger.Level.DEBUG, ToolboxSettings.statementLogLevel());
  }

  private static void assumeNoEnvironmentOverrides() {
    Assumptions.assumeTrue(
        System.getenv(ToolboxSettings.LOCK_MODE_ENV) == null
            && System.getenv(ToolboxSettings.STATEMENT_LOG_LEVEL_ENV) == null,
        "toolbox environment variables are set");
  }
}
