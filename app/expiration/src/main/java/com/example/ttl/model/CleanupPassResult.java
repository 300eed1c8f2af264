/*
 * どこで: TTL ドメインモデル
 * 何を: 1 回のクリーンアップパスの結果サマリを表す
 * なぜ: 手動パスの呼び出し元が例外ではなく常に結果を受け取れるようにするため
 */
package com.example.ttl.model;

import java.time.Instant;
import java.util.List;

public record CleanupPassResult(
    String passId,
    Instant startedAt,
    PassStatus status,
    long totalRowsDeleted,
    List<RuleOutcome> ruleOutcomes,
    String errorMessage) {

  public CleanupPassResult {
    ruleOutcomes = List.copyOf(ruleOutcomes);
  }

  public static CleanupPassResult noActiveRules(String passId, Instant startedAt) {
    return new CleanupPassResult(passId, startedAt, PassStatus.NO_ACTIVE_RULES, 0, List.of(), null);
  }

  public static CleanupPassResult skippedLocked(String passId, Instant startedAt) {
    return new CleanupPassResult(passId, startedAt, PassStatus.SKIPPED_LOCKED, 0, List.of(), null);
  }

  public static CleanupPassResult failed(
      String passId, Instant startedAt, List<RuleOutcome> outcomes, String errorMessage) {
    return new CleanupPassResult(
        passId, startedAt, PassStatus.FAILED, sumRows(outcomes), outcomes, errorMessage);
  }

  public static CleanupPassResult finished(
      String passId, Instant startedAt, List<RuleOutcome> outcomes, boolean interrupted) {
    return new CleanupPassResult(
        passId,
        startedAt,
        interrupted ? PassStatus.INTERRUPTED : PassStatus.COMPLETED,
        sumRows(outcomes),
        outcomes,
        null);
  }

  public long failedRuleCount() {
    return ruleOutcomes.stream().filter(outcome -> !outcome.succeeded()).count();
  }

  private static long sumRows(List<RuleOutcome> outcomes) {
    return outcomes.stream().mapToLong(RuleOutcome::rowsDeleted).sum();
  }
}
