/*
 * どこで: TTL 管理 API
 * 何を: 手動パスの結果とルールごとの内訳を返す
 * なぜ: どのルールが何行削除し、どこで失敗したかを呼び出し元が確認できるようにするため
 */
package com.example.ttl.api;

import com.example.ttl.model.CleanupPassResult;
import com.example.ttl.model.PassStatus;
import com.example.ttl.model.RuleOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CleanupPassResponse(
    String passId,
    Instant startedAt,
    PassStatus status,
    long totalRowsDeleted,
    List<RuleOutcomeResponse> ruleOutcomes,
    String errorMessage) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RuleOutcomeResponse(
      String collectionId, String timeField, long rowsDeleted, int batches, String error) {

    static RuleOutcomeResponse from(RuleOutcome outcome) {
      return new RuleOutcomeResponse(
          outcome.ruleKey().collectionId(),
          outcome.ruleKey().timeField(),
          outcome.rowsDeleted(),
          outcome.batches(),
          outcome.error());
    }
  }

  public static CleanupPassResponse from(CleanupPassResult result) {
    if (result == null) {
      return null;
    }
    return new CleanupPassResponse(
        result.passId(),
        result.startedAt(),
        result.status(),
        result.totalRowsDeleted(),
        result.ruleOutcomes().stream().map(RuleOutcomeResponse::from).toList(),
        result.errorMessage());
  }
}
