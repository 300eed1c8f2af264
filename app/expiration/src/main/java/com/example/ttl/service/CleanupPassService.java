/*
 * どこで: TTL サービス層
 * 何を: single-flight ガード配下で全有効ルールに対し 1 回のパスを実行する
 * なぜ: スケジューラと管理 API で同じパスの意味論を共有するため
 */
package com.example.ttl.service;

import com.example.common.TraceIds;
import com.example.ttl.config.TtlLockProperties;
import com.example.ttl.lock.SingleFlightGuard;
import com.example.ttl.model.CleanupPassResult;
import com.example.ttl.model.ExpirationRule;
import com.example.ttl.model.RuleKey;
import com.example.ttl.model.RuleOutcome;
import com.example.ttl.repository.ExpirationRuleRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;

@Service
public class CleanupPassService {

  private static final Logger logger = LoggerFactory.getLogger(CleanupPassService.class);

  static final String MDC_PASS_ID = "pass_id";
  static final String MDC_RULE_COLLECTION = "rule_collection";
  static final String MDC_RULE_FIELD = "rule_field";

  private final ExpirationRuleRepository ruleRepository;
  private final BatchDeleter batchDeleter;
  private final SingleFlightGuard guard;
  private final ExpirationMetrics metrics;
  private final TtlLockProperties lockProperties;
  private final Clock clock;
  private final AtomicReference<CleanupPassResult> lastResult = new AtomicReference<>();

  public CleanupPassService(
      ExpirationRuleRepository ruleRepository,
      BatchDeleter batchDeleter,
      SingleFlightGuard guard,
      ExpirationMetrics metrics,
      TtlLockProperties lockProperties,
      Clock clock) {
    this.ruleRepository = ruleRepository;
    this.batchDeleter = batchDeleter;
    this.guard = guard;
    this.metrics = metrics;
    this.lockProperties = lockProperties;
    this.clock = clock;
  }

  public CleanupPassResult runOnePass() {
    return runOnePass(() -> false);
  }

  /**
   * 役割:
   * - パスを 1 回実行する。例外は投げず、ストアやガードの失敗は {@code FAILED} の結果で返す。
   *
   * @param stopRequested ルールの合間に確認する。true になったらパスを {@code INTERRUPTED} で終える
   */
  public CleanupPassResult runOnePass(BooleanSupplier stopRequested) {
    final String passId = TraceIds.newShortId();
    // timestamptz の精度に揃え、読み戻した last_run が startedAt と一致するようにする。
    final Instant startedAt = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    MDC.put(MDC_PASS_ID, passId);
    try {
      final CleanupPassResult result = execute(passId, startedAt, stopRequested);
      metrics.recordPass(result.status(), Duration.between(startedAt, Instant.now(clock)));
      lastResult.set(result);
      logResult(result);
      return result;
    } finally {
      MDC.remove(MDC_PASS_ID);
    }
  }

  public Optional<CleanupPassResult> lastResult() {
    return Optional.ofNullable(lastResult.get());
  }

  private CleanupPassResult execute(
      String passId, Instant startedAt, BooleanSupplier stopRequested) {
    final int activeCount;
    try {
      activeCount = ruleRepository.countActive();
    } catch (RuntimeException ex) {
      logger.error("cleanup pass failed to count active rules", ex);
      return CleanupPassResult.failed(passId, startedAt, List.of(), describe(ex));
    }
    metrics.updateActiveRules(activeCount);
    if (activeCount == 0) {
      return CleanupPassResult.noActiveRules(passId, startedAt);
    }

    final String lockName = lockProperties.name();
    final boolean acquired;
    try {
      acquired = guard.tryAcquire(lockName);
    } catch (RuntimeException ex) {
      logger.error("cleanup pass failed to acquire guard lock={}", lockName, ex);
      return CleanupPassResult.failed(passId, startedAt, List.of(), describe(ex));
    }
    if (!acquired) {
      return CleanupPassResult.skippedLocked(passId, startedAt);
    }

    final List<RuleOutcome> outcomes = new ArrayList<>();
    try {
      final List<ExpirationRule> rules = ruleRepository.findActive();
      for (ExpirationRule rule : rules) {
        if (stopRequested.getAsBoolean()) {
          return CleanupPassResult.finished(passId, startedAt, outcomes, true);
        }
        outcomes.add(processRule(rule, startedAt));
      }
      return CleanupPassResult.finished(passId, startedAt, outcomes, false);
    } catch (RuntimeException ex) {
      logger.error("cleanup pass aborted after rules={}", outcomes.size(), ex);
      return CleanupPassResult.failed(passId, startedAt, outcomes, describe(ex));
    } finally {
      releaseGuard(lockName);
    }
  }

  private RuleOutcome processRule(ExpirationRule rule, Instant passStart) {
    final RuleKey key = rule.key();
    MDC.put(MDC_RULE_COLLECTION, key.collectionId());
    MDC.put(MDC_RULE_FIELD, key.timeField());
    try {
      RuleOutcome outcome = batchDeleter.deleteExpired(rule);
      if (outcome.succeeded()) {
        outcome = writeStats(outcome, passStart);
      }
      metrics.recordRowsDeleted(key, outcome.rowsDeleted());
      if (!outcome.succeeded()) {
        metrics.recordRuleFailure(key);
      }
      return outcome;
    } catch (RuntimeException ex) {
      // ルール単位で失敗を閉じ込め、後続ルールとパス全体は継続させる。
      logger.warn("expiration rule failed unexpectedly rule={}", key, ex);
      metrics.recordRuleFailure(key);
      return RuleOutcome.failure(key, 0, 0, describe(ex));
    } finally {
      MDC.remove(MDC_RULE_COLLECTION);
      MDC.remove(MDC_RULE_FIELD);
    }
  }

  private RuleOutcome writeStats(RuleOutcome outcome, Instant passStart) {
    final RuleKey key = outcome.ruleKey();
    try {
      final int updated = ruleRepository.updateStats(key, passStart, outcome.rowsDeleted());
      if (updated == 0) {
        logger.info("expiration rule removed during pass, stats not written rule={}", key);
      }
      return outcome;
    } catch (RuntimeException ex) {
      logger.warn("failed to record stats rule={} rowsDeleted={}", key, outcome.rowsDeleted(), ex);
      return RuleOutcome.failure(
          key, outcome.rowsDeleted(), outcome.batches(), "stats update failed: " + describe(ex));
    }
  }

  private void releaseGuard(String lockName) {
    try {
      guard.release(lockName);
    } catch (RuntimeException ex) {
      // リースはセッションと共に消えるので、次のパスは取得できる。
      logger.warn("failed to release guard lock={}", lockName, ex);
    }
  }

  private void logResult(CleanupPassResult result) {
    switch (result.status()) {
      case SKIPPED_LOCKED -> logger.debug("cleanup pass skipped, guard held elsewhere");
      case NO_ACTIVE_RULES -> logger.debug("cleanup pass skipped, no active rules");
      case FAILED ->
          logger.error(
              "cleanup pass failed rowsDeleted={} error={}",
              result.totalRowsDeleted(),
              result.errorMessage());
      default ->
          logger.info(
              "cleanup pass {} rules={} failedRules={} rowsDeleted={}",
              result.status(),
              result.ruleOutcomes().size(),
              result.failedRuleCount(),
              result.totalRowsDeleted());
    }
  }

  private String describe(RuntimeException ex) {
    final Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }
}
