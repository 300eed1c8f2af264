/*
 * どこで: TTL ルールレジストリ
 * 何を: 不正なルール登録を表す
 * なぜ: IllegalArgumentException のハンドラ経由で BAD_REQUEST に対応させるため
 */
package com.example.ttl.service;

public class InvalidRuleException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidRuleException(String message) {
    super(message);
  }

  public InvalidRuleException(String message, Throwable cause) {
    super(message, cause);
  }
}
