/*
 * どこで: TTL データアクセス
 * 何を: ルール登録時のカタログ参照と時刻フィールド索引の DDL を提供する
 * なぜ: 識別子と列型の検証をパスごとではなく登録時の 1 回で済ませるため
 */
package com.example.ttl.repository;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TableCatalogRepository {

  static final String INDEX_PREFIX = "idx_ttl_";
  // PostgreSQL は識別子を NAMEDATALEN - 1 バイトに切り詰める。
  static final int MAX_IDENTIFIER_LENGTH = 63;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 列の information_schema.data_type を返す。テーブルか列が無ければ empty。 */
  public Optional<String> findColumnType(SqlIdentifier table, SqlIdentifier column) {
    final String sql =
        """
        SELECT data_type
        FROM information_schema.columns
        WHERE table_schema = COALESCE(:schema, current_schema())
          AND table_name = :table
          AND column_name = :column
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("schema", table.schema())
            .addValue("table", table.name())
            .addValue("column", column.name());
    return jdbcTemplate.queryForList(sql, params, String.class).stream().findFirst();
  }

  /** 時刻フィールドの索引が無ければ作成し、その名前(必要ならスキーマ修飾付き)を返す。 */
  public String createTimeFieldIndex(SqlIdentifier table, SqlIdentifier column) {
    final SqlIdentifier index = new SqlIdentifier(table.schema(), indexName(table, column));
    final String ddl =
        "CREATE INDEX IF NOT EXISTS %s ON %s (%s)"
            .formatted(SqlIdentifier.of(index.name()).quoted(), table.quoted(), column.quoted());
    jdbcTemplate.getJdbcTemplate().execute(ddl);
    return index.qualified() ? index.schema() + "." + index.name() : index.name();
  }

  public void dropIndex(String indexRef) {
    final String ddl = "DROP INDEX IF EXISTS " + SqlIdentifier.parseQualified(indexRef).quoted();
    jdbcTemplate.getJdbcTemplate().execute(ddl);
  }

  static String indexName(SqlIdentifier table, SqlIdentifier column) {
    final String name = INDEX_PREFIX + table.name() + "_" + column.name();
    return name.length() <= MAX_IDENTIFIER_LENGTH ? name : name.substring(0, MAX_IDENTIFIER_LENGTH);
  }
}
