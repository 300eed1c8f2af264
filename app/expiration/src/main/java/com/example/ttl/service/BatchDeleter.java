/*
 * どこで: TTL サービス層
 * 何を: 1 ルールの失効済み行を上限付きバッチで削除する
 * なぜ: 無制限の DELETE 1 文は大きなテーブルでロック保持と WAL 肥大を招くため
 */
package com.example.ttl.service;

import com.example.ttl.config.TtlDeletionProperties;
import com.example.ttl.model.ExpirationRule;
import com.example.ttl.model.RuleKey;
import com.example.ttl.model.RuleOutcome;
import com.example.ttl.repository.ExpiredRowRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BatchDeleter {

  private static final Logger logger = LoggerFactory.getLogger(BatchDeleter.class);

  private final ExpiredRowRepository expiredRowRepository;
  private final TtlDeletionProperties properties;
  private final Clock clock;

  /**
   * 役割:
   * - {@code rule} の retention を過ぎた行を削除する。
   * - cutoff はルール開始時に 1 回だけ求める。ループ中に失効した行は次のパスに回す。
   * - 後続バッチが失敗してもコミット済みのバッチは削除されたまま。結果にはエラーとそれまでの削除行数を載せる。
   * - batch size に満たないバッチでルールを終える。並行更新やロックで見えなかった残りは次のパスに回す。
   */
  public RuleOutcome deleteExpired(ExpirationRule rule) {
    final RuleKey key = rule.key();
    final int batchSize = rule.batchSize();
    final Instant now = Instant.now(clock);
    if (rule.expiresNothingAt(now)) {
      logger.debug("expiration rule skipped, retention exceeds stored range rule={}", key);
      return RuleOutcome.success(key, 0, 0);
    }
    final Instant cutoff = rule.cutoff(now);
    long rowsDeleted = 0;
    int batches = 0;
    while (true) {
      final int deleted;
      try {
        deleted = expiredRowRepository.deleteBatch(key, cutoff, batchSize);
      } catch (RuntimeException ex) {
        logger.warn(
            "expiration rule failed rule={} cutoff={} rowsDeleted={} batches={}",
            key,
            cutoff,
            rowsDeleted,
            batches,
            ex);
        return RuleOutcome.failure(key, rowsDeleted, batches, describe(ex));
      }
      if (deleted == 0) {
        break;
      }
      rowsDeleted += deleted;
      batches++;
      if (deleted < batchSize) {
        // 短いバッチは、cutoff より古い行がもう見えないことを意味する。
        break;
      }
      if (!pause()) {
        logger.info(
            "expiration rule interrupted between batches rule={} rowsDeleted={}", key, rowsDeleted);
        break;
      }
    }
    logger.debug(
        "expiration rule finished rule={} cutoff={} rowsDeleted={} batches={}",
        key,
        cutoff,
        rowsDeleted,
        batches);
    return RuleOutcome.success(key, rowsDeleted, batches);
  }

  private boolean pause() {
    final Duration batchPause = properties.batchPause();
    if (batchPause.isZero() || batchPause.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(batchPause.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private String describe(RuntimeException ex) {
    final Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
    return truncate(cause.getClass().getSimpleName() + ": " + cause.getMessage());
  }

  private String truncate(String message) {
    final int max = properties.errorMessageMaxLength();
    return message.length() <= max ? message : message.substring(0, max);
  }
}
