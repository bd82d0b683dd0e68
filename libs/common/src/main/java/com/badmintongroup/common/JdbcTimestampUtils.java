/*
 * どこで: common のユーティリティ
 * 何を: Instant と JDBC Timestamp の相互変換を提供する
 * なぜ: PostgreSQL JDBC に Instant を直接渡すと型推論に失敗する場合があるため
 */
package com.badmintongroup.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC として扱い、DB 側のタイムゾーン設定には依存しない
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
