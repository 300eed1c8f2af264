/*
 * どこで: TTL サービス層
 * 何を: パス結果、削除行数、設定リロードを記録する
 * なぜ: 削除スループットと停滞したランナーを Prometheus から監視するため
 */
package com.example.ttl.service;

import com.example.ttl.model.PassStatus;
import com.example.ttl.model.RuleKey;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a Spring managed shared component and cannot be copied")
public class ExpirationMetrics {

  static final String METRIC_PASS_TOTAL = "ttl.pass.total";
  static final String METRIC_PASS_DURATION = "ttl.pass.duration";
  static final String METRIC_ROWS_DELETED = "ttl.rows.deleted";
  static final String METRIC_RULE_FAILURES = "ttl.rule.failures";
  static final String METRIC_CONFIG_RELOADS = "ttl.scheduler.config.reloads";
  static final String METRIC_RULES_ACTIVE = "ttl.rules.active";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeRules = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> passCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<RuleKey, Counter> rowsDeletedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<RuleKey, Counter> ruleFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> reloadCounters = new ConcurrentHashMap<>();
  private final Timer passDurationTimer;

  public ExpirationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_RULES_ACTIVE, activeRules, AtomicInteger::get)
        .description("Number of active expiration rules seen by the last pass")
        .register(meterRegistry);
    this.passDurationTimer =
        Timer.builder(METRIC_PASS_DURATION)
            .description("Wall time of cleanup passes")
            .register(meterRegistry);
  }

  public void recordPass(PassStatus status, Duration duration) {
    final String result = status.name().toLowerCase(Locale.ROOT);
    passCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_PASS_TOTAL)
                    .description("Cleanup pass outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
    if (duration != null && !duration.isNegative()) {
      passDurationTimer.record(duration);
    }
  }

  public void recordRowsDeleted(RuleKey key, long rows) {
    if (rows <= 0) {
      return;
    }
    rowsDeletedCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_ROWS_DELETED)
                    .description("Rows deleted by expiration rules")
                    .tags(ruleTags(key))
                    .register(meterRegistry))
        .increment(rows);
  }

  public void recordRuleFailure(RuleKey key) {
    ruleFailureCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_RULE_FAILURES)
                    .description("Expiration rules that failed within a pass")
                    .tags(ruleTags(key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordConfigReload(boolean accepted) {
    final String result = accepted ? "accepted" : "rejected";
    reloadCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CONFIG_RELOADS)
                    .description("Scheduler configuration reload attempts")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateActiveRules(int count) {
    activeRules.set(Math.max(count, 0));
  }

  private Tags ruleTags(RuleKey key) {
    return Tags.of("collection", key.collectionId(), "field", key.timeField());
  }
}
