/*
 * どこで: TTL データアクセス
 * 何を: expiration_rules とルールごとの実行統計を読み書きする
 * なぜ: レジストリは全ランナーで共有されるため、書き込みは 1 文で原子的に行う
 */
package com.example.ttl.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.ttl.model.ExpirationRule;
import com.example.ttl.model.RuleKey;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ExpirationRuleRepository {

  private static final String COLUMNS =
      """
      collection_id, time_field, retention_seconds, active, batch_size, created_at, updated_at,
      last_run, rows_deleted_last_run, total_rows_deleted, derived_index_ref
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ExpirationRule upsert(
      RuleKey key, long retentionSeconds, int batchSize, String derivedIndexRef, Instant now) {
    // 再登録ではルールを再有効化し、統計は引き継ぐ。
    final String sql =
        """
        INSERT INTO expiration_rules (
          collection_id,
          time_field,
          retention_seconds,
          active,
          batch_size,
          created_at,
          updated_at,
          derived_index_ref
        ) VALUES (
          :collectionId,
          :timeField,
          :retentionSeconds,
          TRUE,
          :batchSize,
          :now,
          :now,
          :derivedIndexRef
        )
        ON CONFLICT (collection_id, time_field)
        DO UPDATE SET
          retention_seconds = EXCLUDED.retention_seconds,
          batch_size = EXCLUDED.batch_size,
          active = TRUE,
          derived_index_ref = EXCLUDED.derived_index_ref,
          updated_at = EXCLUDED.updated_at
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        keyParams(key)
            .addValue("retentionSeconds", retentionSeconds)
            .addValue("batchSize", batchSize)
            .addValue("derivedIndexRef", derivedIndexRef)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<ExpirationRule> findByKey(RuleKey key) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM expiration_rules
            WHERE collection_id = :collectionId
              AND time_field = :timeField
            """;
    return jdbcTemplate.query(sql, keyParams(key), this::mapRow).stream().findFirst();
  }

  public List<ExpirationRule> findAll() {
    final String sql =
        "SELECT " + COLUMNS + " FROM expiration_rules ORDER BY collection_id, time_field";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<ExpirationRule> findActive() {
    // 処理順を固定し、パスの再現性とログの読みやすさを保つ。
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM expiration_rules
            WHERE active = TRUE
            ORDER BY collection_id, time_field
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public int countActive() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM expiration_rules WHERE active = TRUE",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  public int updateStats(RuleKey key, Instant lastRun, long rowsDeleted) {
    final String sql =
        """
        UPDATE expiration_rules
        SET last_run = :lastRun,
            rows_deleted_last_run = :rowsDeleted,
            total_rows_deleted = total_rows_deleted + :rowsDeleted
        WHERE collection_id = :collectionId
          AND time_field = :timeField
        """;
    final MapSqlParameterSource params =
        keyParams(key)
            .addValue("lastRun", toTimestamp(lastRun))
            .addValue("rowsDeleted", rowsDeleted);
    return jdbcTemplate.update(sql, params);
  }

  public int deactivate(RuleKey key, Instant now) {
    final String sql =
        """
        UPDATE expiration_rules
        SET active = FALSE,
            updated_at = :now
        WHERE collection_id = :collectionId
          AND time_field = :timeField
        """;
    return jdbcTemplate.update(sql, keyParams(key).addValue("now", toTimestamp(now)));
  }

  public int resetStats(RuleKey key, Instant now) {
    final String sql =
        """
        UPDATE expiration_rules
        SET rows_deleted_last_run = 0,
            total_rows_deleted = 0,
            updated_at = :now
        WHERE collection_id = :collectionId
          AND time_field = :timeField
        """;
    return jdbcTemplate.update(sql, keyParams(key).addValue("now", toTimestamp(now)));
  }

  public int delete(RuleKey key) {
    final String sql =
        """
        DELETE FROM expiration_rules
        WHERE collection_id = :collectionId
          AND time_field = :timeField
        """;
    return jdbcTemplate.update(sql, keyParams(key));
  }

  private MapSqlParameterSource keyParams(RuleKey key) {
    return new MapSqlParameterSource()
        .addValue("collectionId", key.collectionId())
        .addValue("timeField", key.timeField());
  }

  private ExpirationRule mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ExpirationRule(
        new RuleKey(rs.getString("collection_id"), rs.getString("time_field")),
        rs.getLong("retention_seconds"),
        rs.getBoolean("active"),
        rs.getInt("batch_size"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"),
        getInstant(rs, "last_run"),
        rs.getLong("rows_deleted_last_run"),
        rs.getLong("total_rows_deleted"),
        rs.getString("derived_index_ref"));
  }
}
