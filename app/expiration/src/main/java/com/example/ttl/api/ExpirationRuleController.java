/*
 * どこで: TTL 管理 API
 * 何を: ルールレジストリ操作と手動クリーンアップパスのエンドポイントを提供する
 * なぜ: expiration_rules への場当たり的な SQL を検証付きの操作に置き換えるため
 */
package com.example.ttl.api;

import com.example.ttl.model.RuleKey;
import com.example.ttl.service.CleanupPassService;
import com.example.ttl.service.ExpirationRuleService;
import com.example.ttl.service.RuleNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/ttl")
@RequiredArgsConstructor
public class ExpirationRuleController {

  private final ExpirationRuleService ruleService;
  private final CleanupPassService cleanupPassService;

  @GetMapping("/rules")
  public RulesResponse list() {
    return new RulesResponse(
        ruleService.summarize().stream().map(RuleResponse::fromSummary).toList());
  }

  @PutMapping("/rules")
  public RuleResponse register(@Valid @RequestBody RuleRegistrationRequest request) {
    return RuleResponse.from(ruleService.register(request.toRegistration()));
  }

  @PostMapping("/rules/{collection}/{field}/deactivate")
  public RuleResponse deactivate(
      @PathVariable("collection") String collection, @PathVariable("field") String field) {
    final RuleKey key = new RuleKey(collection, field);
    ruleService.deactivate(key);
    return RuleResponse.from(ruleService.find(key));
  }

  @PostMapping("/rules/{collection}/{field}/stats/reset")
  public RuleResponse resetStats(
      @PathVariable("collection") String collection, @PathVariable("field") String field) {
    final RuleKey key = new RuleKey(collection, field);
    ruleService.resetStats(key);
    return RuleResponse.from(ruleService.find(key));
  }

  @DeleteMapping("/rules/{collection}/{field}")
  public ResponseEntity<Void> remove(
      @PathVariable("collection") String collection, @PathVariable("field") String field) {
    final RuleKey key = new RuleKey(collection, field);
    if (!ruleService.remove(key)) {
      throw new RuleNotFoundException(key);
    }
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/passes")
  public CleanupPassResponse runPass() {
    return CleanupPassResponse.from(cleanupPassService.runOnePass());
  }
}
