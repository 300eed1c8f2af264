/*
 * どこで: TTL サービス層
 * 何を: 失効ルールの登録/参照/退役を行う
 * なぜ: 検証と索引管理をパスごとではなく登録時に 1 回だけ行うため
 */
package com.example.ttl.service;

import com.example.ttl.model.ExpirationRule;
import com.example.ttl.model.RuleKey;
import com.example.ttl.model.RuleRegistration;
import com.example.ttl.model.RuleSummary;
import com.example.ttl.repository.ExpirationRuleRepository;
import com.example.ttl.repository.SqlIdentifier;
import com.example.ttl.repository.TableCatalogRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ExpirationRuleService {

  private static final Logger logger = LoggerFactory.getLogger(ExpirationRuleService.class);

  static final Set<String> SUPPORTED_COLUMN_TYPES =
      Set.of("timestamp without time zone", "timestamp with time zone", "date");

  private final ExpirationRuleRepository ruleRepository;
  private final TableCatalogRepository tableCatalogRepository;
  private final Clock clock;

  /** ルールを作成/更新する。無効化済みルールの再登録は再有効化になる。 */
  @Transactional
  public ExpirationRule register(RuleRegistration registration) {
    final SqlIdentifier table = parseTable(registration.collectionId());
    final SqlIdentifier column = parseColumn(registration.timeField());
    if (registration.retentionSeconds() < 0) {
      throw new InvalidRuleException("retention_seconds must be >= 0");
    }
    if (registration.batchSizeOrDefault() < 1) {
      throw new InvalidRuleException("batch_size must be >= 1");
    }
    final String columnType =
        tableCatalogRepository
            .findColumnType(table, column)
            .orElseThrow(
                () ->
                    new InvalidRuleException(
                        "column " + registration.key() + " does not exist"));
    if (!SUPPORTED_COLUMN_TYPES.contains(columnType)) {
      throw new InvalidRuleException(
          "column " + registration.key() + " has unsupported type " + columnType);
    }
    final String indexRef = tableCatalogRepository.createTimeFieldIndex(table, column);
    final ExpirationRule rule =
        ruleRepository.upsert(
            registration.key(),
            registration.retentionSeconds(),
            registration.batchSizeOrDefault(),
            indexRef,
            Instant.now(clock));
    logger.info(
        "expiration rule registered rule={} retentionSeconds={} batchSize={} index={}",
        rule.key(),
        rule.retentionSeconds(),
        rule.batchSize(),
        indexRef);
    return rule;
  }

  public List<RuleSummary> summarize() {
    final Instant now = Instant.now(clock);
    return ruleRepository.findAll().stream()
        .map(rule -> new RuleSummary(rule, sinceLastRun(rule, now)))
        .toList();
  }

  public ExpirationRule find(RuleKey key) {
    return ruleRepository.findByKey(key).orElseThrow(() -> new RuleNotFoundException(key));
  }

  public void deactivate(RuleKey key) {
    if (ruleRepository.deactivate(key, Instant.now(clock)) == 0) {
      throw new RuleNotFoundException(key);
    }
    logger.info("expiration rule deactivated rule={}", key);
  }

  public void resetStats(RuleKey key) {
    if (ruleRepository.resetStats(key, Instant.now(clock)) == 0) {
      throw new RuleNotFoundException(key);
    }
    logger.info("expiration rule stats reset rule={}", key);
  }

  /**
   * 役割:
   * - ルールの派生索引を削除し、ルール自体も削除する。
   *
   * @return 該当ルールが存在しなかった場合は false
   */
  @Transactional
  public boolean remove(RuleKey key) {
    final Optional<ExpirationRule> existing = ruleRepository.findByKey(key);
    if (existing.isEmpty()) {
      return false;
    }
    final String indexRef = existing.get().derivedIndexRef();
    if (indexRef != null) {
      tableCatalogRepository.dropIndex(indexRef);
    }
    ruleRepository.delete(key);
    logger.info("expiration rule removed rule={} droppedIndex={}", key, indexRef);
    return true;
  }

  private Duration sinceLastRun(ExpirationRule rule, Instant now) {
    return rule.lastRun() == null ? null : Duration.between(rule.lastRun(), now);
  }

  private SqlIdentifier parseTable(String collectionId) {
    try {
      return SqlIdentifier.parseQualified(collectionId);
    } catch (IllegalArgumentException ex) {
      throw new InvalidRuleException("collection_id is invalid: " + collectionId, ex);
    }
  }

  private SqlIdentifier parseColumn(String timeField) {
    try {
      return SqlIdentifier.of(timeField);
    } catch (IllegalArgumentException ex) {
      throw new InvalidRuleException("time_field is invalid: " + timeField, ex);
    }
  }
}
