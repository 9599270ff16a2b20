/*
 * Where: shared JDBC utilities
 * What: converts between Instant and java.sql.Timestamp for TIMESTAMPTZ columns
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is always UTC; Timestamp.from keeps the same epoch value regardless of the DB zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
