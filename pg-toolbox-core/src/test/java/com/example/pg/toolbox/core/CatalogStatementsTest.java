package com.example.pg.toolbox.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

class CatalogStatementsTest {

  @Test
  @DisplayName("Should quote object names in DDL")
  void shouldQuoteNames() {
    assertEquals("CREATE DATABASE \"orders\"", CatalogStatements.createDatabase("orders"));
    assertEquals("DROP DATABASE \"or\"\"ders\"", CatalogStatements.dropDatabase("or\"ders"));
    assertEquals("DROP ROLE \"app\"", CatalogStatements.dropRole("app"));
    assertEquals("GRANT \"readers\" TO \"app\"", CatalogStatements.grantRole("readers", "app"));
    assertEquals("SET ROLE \"app\"", CatalogStatements.setRole("app"));
  }

  @Test
  @DisplayName("Should build CREATE ROLE with optional LOGIN and PASSWORD")
  void shouldBuildCreateRole() {
    assertEquals("CREATE ROLE \"app\"", CatalogStatements.createRole("app", null, false));
    assertEquals("CREATE ROLE \"app\" LOGIN", CatalogStatements.createRole("app", null, true));
    assertEquals(
        "CREATE ROLE \"app\" LOGIN PASSWORD 'it''s'",
        CatalogStatements.createRole("app", "it's", true));
  }

  @Test
  @DisplayName("Should mask passwords for logging")
  void shouldRedactPasswords() {
    assertEquals(
        "CREATE ROLE \"app\" LOGIN PASSWORD ****",
        CatalogStatements.redact(CatalogStatements.createRole("app", "s3cret", true)));
    assertEquals("DROP ROLE \"app\"", CatalogStatements.redact("DROP ROLE \"app\""));
    assertEquals(
        "alter role app with password ****",
        CatalogStatements.redact("alter role app with password 'n3w' valid until 'infinity'"));
  }

  @Test
  @DisplayName("Should build lookups with driver bind markers")
  void shouldUseBindMarkers() {
    assertEquals(
        "SELECT 1 FROM pg_database WHERE datname = $1", CatalogStatements.databaseExists("$1"));
    assertEquals("SELECT 1 FROM pg_roles WHERE rolname = ?", CatalogStatements.roleExists("?"));
    assertEquals(
        "SELECT rolname FROM pg_roles WHERE rolname IN ($1, $2, $3)",
        CatalogStatements.rolesIn(3, i -> "$" + (i + 1)));
  }
}
