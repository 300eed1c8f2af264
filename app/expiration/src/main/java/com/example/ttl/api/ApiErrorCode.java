/*
 * どこで: TTL 管理 API
 * 何を: エラーレスポンスのコードを列挙する
 * なぜ: クライアントが HTTP ステータスより細かく分岐できるようにするため
 */
package com.example.ttl.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  RULE_NOT_FOUND,
  INVALID_SCHEDULER_CONFIG
}
