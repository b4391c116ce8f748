package com.example.pg.toolbox.core.locks;

import com.example.pg.toolbox.core.SqlIdentifiers;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Key of a PostgreSQL advisory lock.
 *
 * <p>PostgreSQL has two independent advisory key spaces: a single {@code bigint}, and a pair of
 * {@code int}s. A key built with {@link #of(long)} never collides with one built with {@link
 * #of(int, int)}, even when the numbers look alike.
 *
 * <p>Names are mapped by {@link #forName(String)}: the first eight bytes of the SHA-256 digest of
 * the UTF-8 encoded name, read big-endian as a signed {@code long}. The mapping does not depend on
 * the JVM, the process or the server, so every application instance derives the same key for the
 * same resource name.
 */
public final class AdvisoryLockKey {

  private final long key;
  private final int classId;
  private final int objectId;
  private final boolean pair;
  private final String name;

  private AdvisoryLockKey(
      final long key,
      final int classId,
      final int objectId,
      final boolean pair,
      final String name) {
    this.key = key;
    this.classId = classId;
    this.objectId = objectId;
    this.pair = pair;
    this.name = name;
  }

  /**
   * Single 64-bit key.
   *
   * @param key lock key
   * @return the key
   */
  public static AdvisoryLockKey of(final long key) {
    return new AdvisoryLockKey(key, 0, 0, false, null);
  }

  /**
   * Two 32-bit keys, for the {@code (int, int)} key space.
   *
   * @param classId first key, conventionally the kind of resource
   * @param objectId second key, conventionally the resource id
   * @return the key
   */
  public static AdvisoryLockKey of(final int classId, final int objectId) {
    return new AdvisoryLockKey(0L, classId, objectId, true, null);
  }

  /**
   * Derives a 64-bit key from a logical resource name.
   *
   * <pre>{@code
   * var key = AdvisoryLockKey.forName("billing:nightly-export");
   * }</pre>
   *
   * @param name resource name, not blank
   * @return the key
   */
  public static AdvisoryLockKey forName(final String name) {
    SqlIdentifiers.requireName(name, "lock name");
    return new AdvisoryLockKey(hash(name), 0, 0, false, name);
  }

  static long hash(final String name) {
    try {
      final var digest =
          MessageDigest.getInstance("SHA-256").digest(name.getBytes(StandardCharsets.UTF_8));
      return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
    } catch (final NoSuchAlgorithmException e) {
      // every JRE must provide SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /** Returns true for a {@code (int, int)} key. */
  public boolean isPair() {
    return pair;
  }

  /** The 64-bit key; only meaningful when {@link #isPair()} is false. */
  public long key() {
    return key;
  }

  /** The first of the two 32-bit keys; only meaningful when {@link #isPair()} is true. */
  public int classId() {
    return classId;
  }

  /** The second of the two 32-bit keys; only meaningful when {@link #isPair()} is true. */
  public int objectId() {
    return objectId;
  }

  /** Values to bind, in order: one {@code Long} or two {@code Integer}s. */
  public List<Object> arguments() {
    return pair ? List.of(classId, objectId) : List.of(key);
  }

  /**
   * Builds the {@code SELECT} calling an advisory lock function with this key.
   *
   * <pre>{@code
   * key.call("pg_advisory_unlock", i -> "?");         // JDBC
   * key.call("pg_advisory_unlock", i -> "$" + (i + 1)); // R2DBC PostgreSQL
   * }</pre>
   *
   * @param function advisory lock function name
   * @param placeholder driver-specific bind marker for the zero-based parameter index
   * @return the statement text
   */
  public String call(final String function, final IntFunction<String> placeholder) {
    final var args =
        pair ? placeholder.apply(0) + ", " + placeholder.apply(1) : placeholder.apply(0);
    return "SELECT " + function + "(" + args + ")";
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof AdvisoryLockKey other)) return false;
    return key == other.key
        && classId == other.classId
        && objectId == other.objectId
        && pair == other.pair;
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, classId, objectId, pair);
  }

  @Override
  public String toString() {
    if (pair) return "(" + classId + ", " + objectId + ")";
    return name == null ? Long.toString(key) : "'" + name + "' (" + key + ")";
  }
}
