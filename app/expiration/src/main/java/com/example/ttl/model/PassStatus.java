/*
 * どこで: TTL ドメインモデル
 * 何を: クリーンアップパスの終了状態を表す列挙
 * なぜ: スキップと失敗と中断をログ/メトリクスで区別するため
 */
package com.example.ttl.model;

public enum PassStatus {
  COMPLETED,
  NO_ACTIVE_RULES,
  SKIPPED_LOCKED,
  INTERRUPTED,
  FAILED
}
