/*
 * どこで: ExpirationRuleService の統合テスト
 * 何を: 登録時の検証、派生索引のライフサイクル、サマリを検証する
 * なぜ: 不正なルールをパスが削除を試みる前に弾くため
 */
package com.example.ttl.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.ttl.AbstractPostgresContainerTest;
import com.example.ttl.model.ExpirationRule;
import com.example.ttl.model.RuleKey;
import com.example.ttl.model.RuleRegistration;
import com.example.ttl.model.RuleSummary;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ExpirationRuleServiceTest extends AbstractPostgresContainerTest {

  private static final RuleKey EVENTS = new RuleKey("svc_events", "created_at");

  @Autowired private ExpirationRuleService service;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.execute("DELETE FROM expiration_rules");
    jdbcTemplate.execute("DROP TABLE IF EXISTS svc_events");
    jdbcTemplate.execute(
        "CREATE TABLE svc_events (id BIGSERIAL PRIMARY KEY, created_at TIMESTAMPTZ, title TEXT)");
  }

  @Test
  void registerCreatesIndexAndDefaultsBatchSize() {
    final ExpirationRule rule =
        service.register(new RuleRegistration("svc_events", "created_at", 3_600, null));

    assertThat(rule.batchSize()).isEqualTo(ExpirationRule.DEFAULT_BATCH_SIZE);
    assertThat(rule.derivedIndexRef()).isEqualTo("idx_ttl_svc_events_created_at");
    assertThat(indexCount("idx_ttl_svc_events_created_at")).isEqualTo(1);
  }

  @Test
  void registerTwiceUpdatesRetention() {
    service.register(new RuleRegistration("svc_events", "created_at", 3_600, 50));
    service.deactivate(EVENTS);

    final ExpirationRule rule =
        service.register(new RuleRegistration("svc_events", "created_at", 60, 10));

    assertThat(rule.active()).isTrue();
    assertThat(rule.retentionSeconds()).isEqualTo(60);
    assertThat(rule.batchSize()).isEqualTo(10);
  }

  @Test
  void registerRejectsNonTemporalColumn() {
    assertThatThrownBy(
            () -> service.register(new RuleRegistration("svc_events", "title", 60, null)))
        .isInstanceOf(InvalidRuleException.class)
        .hasMessageContaining("unsupported type text");
  }

  @Test
  void registerRejectsMissingColumnAndTable() {
    assertThatThrownBy(
            () -> service.register(new RuleRegistration("svc_events", "missing", 60, null)))
        .isInstanceOf(InvalidRuleException.class)
        .hasMessageContaining("does not exist");
    assertThatThrownBy(
            () -> service.register(new RuleRegistration("nowhere", "created_at", 60, null)))
        .isInstanceOf(InvalidRuleException.class);
  }

  @Test
  void registerRejectsUnsafeIdentifiersAndBadNumbers() {
    assertThatThrownBy(
            () ->
                service.register(
                    new RuleRegistration("svc_events; DROP TABLE x", "created_at", 60, null)))
        .isInstanceOf(InvalidRuleException.class)
        .hasMessageStartingWith("collection_id is invalid");
    assertThatThrownBy(
            () -> service.register(new RuleRegistration("svc_events", "created_at", -1, null)))
        .isInstanceOf(InvalidRuleException.class);
    assertThatThrownBy(
            () -> service.register(new RuleRegistration("svc_events", "created_at", 60, 0)))
        .isInstanceOf(InvalidRuleException.class);
    assertThat(service.summarize()).isEmpty();
  }

  @Test
  void removeDropsIndexAndReportsExistence() {
    service.register(new RuleRegistration("svc_events", "created_at", 60, null));

    assertThat(service.remove(EVENTS)).isTrue();
    assertThat(service.remove(EVENTS)).isFalse();
    assertThat(indexCount("idx_ttl_svc_events_created_at")).isZero();
  }

  @Test
  void summaryHasNoElapsedTimeBeforeFirstRun() {
    service.register(new RuleRegistration("svc_events", "created_at", 60, null));

    final List<RuleSummary> summaries = service.summarize();

    assertThat(summaries).hasSize(1);
    assertThat(summaries.get(0).timeSinceLastRun()).isNull();
  }

  @Test
  void operationsOnUnknownRuleThrowNotFound() {
    assertThatThrownBy(() -> service.deactivate(EVENTS)).isInstanceOf(RuleNotFoundException.class);
    assertThatThrownBy(() -> service.resetStats(EVENTS)).isInstanceOf(RuleNotFoundException.class);
    assertThatThrownBy(() -> service.find(EVENTS)).isInstanceOf(RuleNotFoundException.class);
  }

  private int indexCount(String name) {
    return jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM pg_indexes WHERE schemaname = current_schema() AND indexname = ?",
        Integer.class,
        name);
  }
}
