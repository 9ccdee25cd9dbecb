/*
 * Where: Shared utilities
 * What: Converts between Instant and JDBC Timestamp in both directions
 * Why: The PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.hirewise.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps the epoch value so the session time zone never shifts it.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
