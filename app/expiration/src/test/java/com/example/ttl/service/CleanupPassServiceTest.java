/*
 * どこで: CleanupPassService の単体テスト
 * 何を: ガード処理、ルール単位の分離、統計書き戻し、中断を検証する
 * なぜ: パスは必ずガードを解放し、スケジューラへ例外を投げないことを保証するため
 */
package com.example.ttl.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.ttl.config.TtlLockProperties;
import com.example.ttl.lock.SingleFlightGuard;
import com.example.ttl.model.CleanupPassResult;
import com.example.ttl.model.ExpirationRule;
import com.example.ttl.model.PassStatus;
import com.example.ttl.model.RuleKey;
import com.example.ttl.model.RuleOutcome;
import com.example.ttl.repository.ExpirationRuleRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class CleanupPassServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String LOCK_NAME = "ttl_expiration_runner";
  private static final RuleKey AUDIT = new RuleKey("audit", "logged_at");
  private static final RuleKey ORDERS = new RuleKey("orders", "created_at");
  private static final RuleKey SESSIONS = new RuleKey("sessions", "last_seen");

  @Mock private ExpirationRuleRepository ruleRepository;
  @Mock private BatchDeleter batchDeleter;
  @Mock private SingleFlightGuard guard;

  private CleanupPassService service;

  @BeforeEach
  void setUp() {
    service =
        new CleanupPassService(
            ruleRepository,
            batchDeleter,
            guard,
            new ExpirationMetrics(new SimpleMeterRegistry()),
            new TtlLockProperties(LOCK_NAME),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void noActiveRulesSkipsGuard() {
    when(ruleRepository.countActive()).thenReturn(0);

    final CleanupPassResult result = service.runOnePass();

    assertThat(result.status()).isEqualTo(PassStatus.NO_ACTIVE_RULES);
    assertThat(result.totalRowsDeleted()).isZero();
    verifyNoInteractions(guard, batchDeleter);
  }

  @Test
  void guardHeldElsewhereSkipsPass() {
    when(ruleRepository.countActive()).thenReturn(2);
    when(guard.tryAcquire(LOCK_NAME)).thenReturn(false);

    final CleanupPassResult result = service.runOnePass();

    assertThat(result.status()).isEqualTo(PassStatus.SKIPPED_LOCKED);
    assertThat(result.totalRowsDeleted()).isZero();
    verify(ruleRepository, never()).findActive();
    verify(guard, never()).release(anyString());
  }

  @Test
  void failingRuleDoesNotStopOthersAndKeepsItsStatsUntouched() {
    stubActive(rule(AUDIT), rule(ORDERS), rule(SESSIONS));
    when(batchDeleter.deleteExpired(rule(AUDIT))).thenReturn(RuleOutcome.success(AUDIT, 4, 1));
    when(batchDeleter.deleteExpired(rule(ORDERS)))
        .thenReturn(RuleOutcome.failure(ORDERS, 10, 1, "boom"));
    when(batchDeleter.deleteExpired(rule(SESSIONS)))
        .thenReturn(RuleOutcome.success(SESSIONS, 0, 0));

    final CleanupPassResult result = service.runOnePass();

    assertThat(result.status()).isEqualTo(PassStatus.COMPLETED);
    assertThat(result.ruleOutcomes())
        .extracting(RuleOutcome::ruleKey)
        .containsExactly(AUDIT, ORDERS, SESSIONS);
    assertThat(result.failedRuleCount()).isEqualTo(1);
    assertThat(result.totalRowsDeleted()).isEqualTo(14);
    verify(ruleRepository).updateStats(AUDIT, NOW, 4);
    verify(ruleRepository).updateStats(SESSIONS, NOW, 0);
    verify(ruleRepository, never()).updateStats(eq(ORDERS), any(), anyLong());
    verify(guard).release(LOCK_NAME);
  }

  @Test
  void unexpectedRuleErrorIsIsolatedAndLaterRulesStillRun() {
    stubActive(rule(AUDIT), rule(ORDERS));
    when(batchDeleter.deleteExpired(rule(AUDIT)))
        .thenThrow(new DateTimeException("Instant exceeds minimum or maximum instant"));
    when(batchDeleter.deleteExpired(rule(ORDERS))).thenReturn(RuleOutcome.success(ORDERS, 3, 1));

    final CleanupPassResult result = service.runOnePass();

    assertThat(result.status()).isEqualTo(PassStatus.COMPLETED);
    assertThat(result.ruleOutcomes())
        .extracting(RuleOutcome::ruleKey)
        .containsExactly(AUDIT, ORDERS);
    assertThat(result.ruleOutcomes().get(0).succeeded()).isFalse();
    assertThat(result.ruleOutcomes().get(0).error()).startsWith("DateTimeException");
    assertThat(result.totalRowsDeleted()).isEqualTo(3);
    verify(ruleRepository).updateStats(ORDERS, NOW, 3);
    verify(ruleRepository, never()).updateStats(eq(AUDIT), any(), anyLong());
    verify(guard).release(LOCK_NAME);
  }

  @Test
  void statsWritebackFailureMarksRuleFailed() {
    stubActive(rule(ORDERS));
    when(batchDeleter.deleteExpired(rule(ORDERS))).thenReturn(RuleOutcome.success(ORDERS, 3, 1));
    when(ruleRepository.updateStats(ORDERS, NOW, 3))
        .thenThrow(new DataAccessResourceFailureException("connection reset"));

    final CleanupPassResult result = service.runOnePass();

    assertThat(result.status()).isEqualTo(PassStatus.COMPLETED);
    assertThat(result.ruleOutcomes().get(0).error()).startsWith("stats update failed");
    assertThat(result.totalRowsDeleted()).isEqualTo(3);
    verify(guard).release(LOCK_NAME);
  }

  @Test
  void stopRequestEndsPassBetweenRules() {
    stubActive(rule(AUDIT), rule(ORDERS));
    when(batchDeleter.deleteExpired(rule(AUDIT))).thenReturn(RuleOutcome.success(AUDIT, 1, 1));
    final AtomicInteger polls = new AtomicInteger();

    final CleanupPassResult result = service.runOnePass(() -> polls.getAndIncrement() > 0);

    assertThat(result.status()).isEqualTo(PassStatus.INTERRUPTED);
    assertThat(result.ruleOutcomes()).extracting(RuleOutcome::ruleKey).containsExactly(AUDIT);
    verify(batchDeleter, never()).deleteExpired(rule(ORDERS));
    verify(guard).release(LOCK_NAME);
  }

  @Test
  void enumerationFailureIsReportedAndGuardReleased() {
    when(ruleRepository.countActive()).thenReturn(1);
    when(guard.tryAcquire(LOCK_NAME)).thenReturn(true);
    when(ruleRepository.findActive())
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    final CleanupPassResult result = service.runOnePass();

    assertThat(result.status()).isEqualTo(PassStatus.FAILED);
    assertThat(result.errorMessage()).contains("connection refused");
    verify(guard).release(LOCK_NAME);
    assertThat(service.lastResult()).contains(result);
  }

  @Test
  void guardErrorIsReportedWithoutThrowing() {
    when(ruleRepository.countActive()).thenReturn(1);
    when(guard.tryAcquire(LOCK_NAME))
        .thenThrow(new DataAccessResourceFailureException("too many connections"));

    final CleanupPassResult result = service.runOnePass();

    assertThat(result.status()).isEqualTo(PassStatus.FAILED);
    verify(guard, never()).release(anyString());
  }

  @Test
  void releaseFailureDoesNotChangeResult() {
    stubActive(rule(ORDERS));
    when(batchDeleter.deleteExpired(rule(ORDERS))).thenReturn(RuleOutcome.success(ORDERS, 0, 0));
    doThrow(new DataAccessResourceFailureException("gone"))
        .when(guard)
        .release(LOCK_NAME);

    final CleanupPassResult result = service.runOnePass();

    assertThat(result.status()).isEqualTo(PassStatus.COMPLETED);
  }

  private void stubActive(ExpirationRule... rules) {
    when(ruleRepository.countActive()).thenReturn(rules.length);
    when(guard.tryAcquire(LOCK_NAME)).thenReturn(true);
    when(ruleRepository.findActive()).thenReturn(List.of(rules));
  }

  private ExpirationRule rule(RuleKey key) {
    return new ExpirationRule(key, 60, true, 100, NOW, NOW, null, 0, 0, null);
  }
}
