/*
 * どこで: 共通 JDBC 補助
 * 何を: JDBC 境界で Instant と java.sql.Timestamp を相互変換する
 * なぜ: PostgreSQL ドライバは Instant パラメータの SQL 型を推論できないため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は常に UTC。Timestamp.from は DB のタイムゾーンに関係なく同じエポック値を保つ。
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
