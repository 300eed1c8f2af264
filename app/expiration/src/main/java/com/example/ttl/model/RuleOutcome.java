/*
 * どこで: TTL ドメインモデル
 * 何を: パス内で 1 ルールを処理した結果を表す
 * なぜ: 失敗を値として運び、壊れたルール 1 つでパスを中断させないため
 */
package com.example.ttl.model;

public record RuleOutcome(RuleKey ruleKey, long rowsDeleted, int batches, String error) {

  public static RuleOutcome success(RuleKey ruleKey, long rowsDeleted, int batches) {
    return new RuleOutcome(ruleKey, rowsDeleted, batches, null);
  }

  public static RuleOutcome failure(RuleKey ruleKey, long rowsDeleted, int batches, String error) {
    return new RuleOutcome(ruleKey, rowsDeleted, batches, error == null ? "unknown error" : error);
  }

  public boolean succeeded() {
    return error == null;
  }
}
