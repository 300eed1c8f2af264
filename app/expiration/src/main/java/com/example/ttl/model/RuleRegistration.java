/*
 * どこで: TTL ドメインモデル
 * 何を: 冪等なルール upsert の入力を表す
 * なぜ: サービス層を HTTP リクエストの形から独立させるため
 */
package com.example.ttl.model;

public record RuleRegistration(
    String collectionId, String timeField, long retentionSeconds, Integer batchSize) {

  public int batchSizeOrDefault() {
    return batchSize == null ? ExpirationRule.DEFAULT_BATCH_SIZE : batchSize;
  }

  public RuleKey key() {
    return new RuleKey(collectionId, timeField);
  }
}
