/*
 * どこで: TTL single-flight ガード補助
 * 何を: ロック名から 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突で別名のロックが共有されるのを避けるため
 */
package com.example.ttl.lock;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class LockKeyGenerator {

  // 64-bit advisory lock 用に SHA-256 の先頭 8byte を使う。
  static final int LOCK_KEY_BYTES = 8;

  public long generate(String lockName) {
    // ロック名が違えばキーも違う、という前提を 64-bit で実質的に満たす。
    // 文字コードは UTF-8 固定。別言語のランナーや psql からも同じキーを再現できるようにする。
    final byte[] hashed = hash(lockName);
    // ByteBuffer 既定の Big Endian のまま読む。
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String lockName) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(lockName.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      // SHA-256 が無い JVM は前提外なので即失敗させる。
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
