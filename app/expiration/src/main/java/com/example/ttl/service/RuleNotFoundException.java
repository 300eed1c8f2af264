/*
 * どこで: TTL ルールレジストリ
 * 何を: 存在しないルールへの操作を表す
 * なぜ: 管理 API で 404 に対応させるため
 */
package com.example.ttl.service;

import com.example.ttl.model.RuleKey;

public class RuleNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RuleNotFoundException(RuleKey key) {
    super("expiration rule not found: " + key);
  }
}
