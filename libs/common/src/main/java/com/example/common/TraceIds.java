package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** クリーンアップパスなどバックグラウンド処理のログ相関に使う短い形式。 */
  public static String newShortId() {
    return newTraceId().substring(0, 8);
  }
}
