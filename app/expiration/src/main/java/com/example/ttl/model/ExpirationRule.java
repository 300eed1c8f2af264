/*
 * どこで: TTL ドメインモデル
 * 何を: expiration_rules の 1 行と実行統計のスナップショットを表す
 * なぜ: パスのオーケストレータと管理 API で同じ不変ビューを共有するため
 */
package com.example.ttl.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

public record ExpirationRule(
    RuleKey key,
    long retentionSeconds,
    boolean active,
    int batchSize,
    Instant createdAt,
    Instant updatedAt,
    Instant lastRun,
    long rowsDeletedLastRun,
    long totalRowsDeleted,
    String derivedIndexRef) {

  public static final int DEFAULT_BATCH_SIZE = 10_000;

  // PostgreSQL の timestamp/date が保持できる最古値(4713 BC)より前。これ以前の cutoff では何も失効しない。
  public static final Instant EARLIEST_STORABLE_TIME =
      LocalDate.of(-4713, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();

  /**
   * 役割:
   * - 時刻フィールドが戻り値より厳密に前の行を失効済みとみなす境界を返す。
   * - {@link #EARLIEST_STORABLE_TIME} を越える retention はその時刻に丸め、何も失効させない。
   */
  public Instant cutoff(Instant now) {
    final long secondsSinceEarliest =
        now.getEpochSecond() - EARLIEST_STORABLE_TIME.getEpochSecond();
    if (retentionSeconds >= secondsSinceEarliest) {
      return EARLIEST_STORABLE_TIME;
    }
    return now.minusSeconds(retentionSeconds);
  }

  /** retention がストアに保持できる範囲を越えていれば true。 */
  public boolean expiresNothingAt(Instant now) {
    return !cutoff(now).isAfter(EARLIEST_STORABLE_TIME);
  }
}
