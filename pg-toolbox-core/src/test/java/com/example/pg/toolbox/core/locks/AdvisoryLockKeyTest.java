package com.example.pg.toolbox.core.locks;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.*;

class AdvisoryLockKeyTest {

  @Nested
  @DisplayName("Name derivation")
  class NameDerivation {

    @Test
    @DisplayName("Should derive the first eight SHA-256 bytes as a big-endian long")
    void shouldMatchKnownDigests() {
      assertEquals(7293107376025774468L, AdvisoryLockKey.forName("billing:nightly-export").key());
      assertEquals(-3848465438864589366L, AdvisoryLockKey.forName("a").key());
      assertEquals(-5134515445841379662L, AdvisoryLockKey.forName("ünïcode").key());
    }

    @Test
    @DisplayName("Same name yields the same key every time")
    void shouldBeDeterministic() {
      assertEquals(
          AdvisoryLockKey.forName("jobs:reindex"), AdvisoryLockKey.forName("jobs:reindex"));
      assertEquals(AdvisoryLockKey.hash("jobs:reindex"), AdvisoryLockKey.hash("jobs:reindex"));
    }

    @Test
    @DisplayName("Different names yield different keys")
    void shouldDistinguishNames() {
      assertNotEquals(
          AdvisoryLockKey.forName("jobs:reindex").key(),
          AdvisoryLockKey.forName("jobs:reindex2").key());
    }

    @Test
    @DisplayName("Named key equals the numeric key it maps to")
    void shouldEqualNumericKey() {
      final var named = AdvisoryLockKey.forName("a");
      assertEquals(AdvisoryLockKey.of(-3848465438864589366L), named);
      assertTrue(named.toString().contains("'a'"));
    }

    @Test
    @DisplayName("Should reject blank names")
    void shouldRejectBlank() {
      assertThrows(IllegalArgumentException.class, () -> AdvisoryLockKey.forName(null));
      assertThrows(IllegalArgumentException.class, () -> AdvisoryLockKey.forName(""));
      assertThrows(IllegalArgumentException.class, () -> AdvisoryLockKey.forName("   "));
    }
  }

  @Nested
  @DisplayName("Key spaces")
  class KeySpaces {

    @Test
    @DisplayName("Single and pair keys never compare equal")
    void shouldSeparateKeySpaces() {
      assertNotEquals(AdvisoryLockKey.of(0L), AdvisoryLockKey.of(0, 0));
      assertNotEquals(AdvisoryLockKey.of(1L), AdvisoryLockKey.of(0, 1));
    }

    @Test
    @DisplayName("Should bind one long for a single key")
    void shouldBindSingle() {
      final var key = AdvisoryLockKey.of(42L);
      assertFalse(key.isPair());
      assertEquals(List.of(42L), key.arguments());
      assertEquals("SELECT pg_advisory_lock(?)", key.call("pg_advisory_lock", i -> "?"));
    }

    @Test
    @DisplayName("Should bind two ints for a pair key")
    void shouldBindPair() {
      final var key = AdvisoryLockKey.of(7, 9);
      assertTrue(key.isPair());
      assertEquals(7, key.classId());
      assertEquals(9, key.objectId());
      assertEquals(List.of(7, 9), key.arguments());
      assertEquals(
          "SELECT pg_try_advisory_lock($1, $2)",
          key.call("pg_try_advisory_lock", i -> "$" + (i + 1)));
      assertEquals("(7, 9)", key.toString());
    }

    @Test
    @DisplayName("Equal keys share a hash code")
    void shouldHashConsistently() {
      assertEquals(AdvisoryLockKey.of(3, 4).hashCode(), AdvisoryLockKey.of(3, 4).hashCode());
      assertEquals(AdvisoryLockKey.of(5L).hashCode(), AdvisoryLockKey.of(5L).hashCode());
    }
  }
}
