package com.example.ttl.lock;

/**
 * 役割:
 * - 同じストアを向く全エンジンインスタンス間で、名前単位の相互排他を提供する。
 * - {@link #tryAcquire(String)} はブロックしない。
 * - 保持者が落ちるとリースも失われるため、フェンシングは保証しない。
 */
public interface SingleFlightGuard {

  /**
   * @return 呼び出し元が名前付きリースを取得できたら true
   */
  boolean tryAcquire(String name);

  /** 保持中のリースを解放する。保持していない名前の解放は何もしない。 */
  void release(String name);
}
