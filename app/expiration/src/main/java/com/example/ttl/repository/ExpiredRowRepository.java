/*
 * どこで: TTL データアクセス
 * 何を: ルール対象テーブルから失効行を上限付きで 1 バッチ削除する
 * なぜ: 上限付きの文でロックとトランザクションの保持時間を短く保つため
 */
package com.example.ttl.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.ttl.model.RuleKey;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ExpiredRowRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割:
   * - 時刻フィールドが {@code cutoff} より厳密に前の行を最大 {@code limit} 件削除する。
   * - 行は ctid で指定し、時刻フィールドの索引を 2 度たどらない。
   * - 文ごとに auto-commit のトランザクションで実行する。
   *
   * @return 実際に削除した行数
   */
  public int deleteBatch(RuleKey key, Instant cutoff, int limit) {
    final String table = SqlIdentifier.parseQualified(key.collectionId()).quoted();
    final String column = SqlIdentifier.of(key.timeField()).quoted();
    final String sql =
        """
        DELETE FROM %1$s
        WHERE ctid = ANY(ARRAY(
          SELECT ctid
          FROM %1$s
          WHERE %2$s < :cutoff
          LIMIT :limit
        ))
        """
            .formatted(table, column);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("limit", limit);
    return jdbcTemplate.update(sql, params);
  }
}
