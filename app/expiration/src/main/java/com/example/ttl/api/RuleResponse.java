/*
 * どこで: TTL 管理 API
 * 何を: ルールと実行統計のレスポンスを表す
 * なぜ: DB の列名に合わせた snake_case で運用者に返すため
 */
package com.example.ttl.api;

import com.example.ttl.model.ExpirationRule;
import com.example.ttl.model.RuleSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleResponse(
    String collectionId,
    String timeField,
    long retentionSeconds,
    boolean active,
    int batchSize,
    Instant createdAt,
    Instant updatedAt,
    Instant lastRun,
    Long secondsSinceLastRun,
    long rowsDeletedLastRun,
    long totalRowsDeleted,
    String derivedIndexRef) {

  public static RuleResponse from(ExpirationRule rule) {
    return fromSummary(new RuleSummary(rule, null));
  }

  public static RuleResponse fromSummary(RuleSummary summary) {
    final ExpirationRule rule = summary.rule();
    return new RuleResponse(
        rule.key().collectionId(),
        rule.key().timeField(),
        rule.retentionSeconds(),
        rule.active(),
        rule.batchSize(),
        rule.createdAt(),
        rule.updatedAt(),
        rule.lastRun(),
        summary.timeSinceLastRun() == null ? null : summary.timeSinceLastRun().toSeconds(),
        rule.rowsDeletedLastRun(),
        rule.totalRowsDeleted(),
        rule.derivedIndexRef());
  }
}
