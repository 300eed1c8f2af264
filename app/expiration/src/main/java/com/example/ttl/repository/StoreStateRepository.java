/*
 * どこで: TTL データアクセス
 * 何を: 接続先が書き込みを受け付ける状態かを返す
 * なぜ: リカバリ中のスタンバイは削除を拒否するため、その tick をスキップする
 */
package com.example.ttl.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class StoreStateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean isInRecovery() {
    final Boolean inRecovery =
        jdbcTemplate.queryForObject(
            "SELECT pg_is_in_recovery()", new MapSqlParameterSource(), Boolean.class);
    return Boolean.TRUE.equals(inRecovery);
  }
}
