package com.example.pg.toolbox.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

class SqlIdentifiersTest {

  @Test
  @DisplayName("Should double embedded double quotes")
  void shouldQuoteIdentifiers() {
    assertEquals("\"app_reader\"", SqlIdentifiers.quote("app_reader"));
    assertEquals("\"we\"\"ird\"", SqlIdentifiers.quote("we\"ird"));
    assertEquals("\"Mixed Case\"", SqlIdentifiers.quote("Mixed Case"));
  }

  @Test
  @DisplayName("Should double embedded single quotes in literals")
  void shouldQuoteLiterals() {
    assertEquals("'s3cret'", SqlIdentifiers.literal("s3cret"));
    assertEquals("'it''s'", SqlIdentifiers.literal("it's"));
    assertEquals("''", SqlIdentifiers.literal(""));
  }

  @Test
  @DisplayName("Should reject blank or NUL-containing names")
  void shouldRejectInvalidNames() {
    assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote(null));
    assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote(" "));
    assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote("a\0b"));
    assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.literal("a\0b"));
    assertThrows(NullPointerException.class, () -> SqlIdentifiers.literal(null));
  }

  @Test
  @DisplayName("Error message names what was missing")
  void shouldNameMissingArgument() {
    final var e =
        assertThrows(
            IllegalArgumentException.class, () -> SqlIdentifiers.requireName("", "role"));
    assertEquals("role is required", e.getMessage());
  }
}
