/*
 * どこで: TTL 管理 API
 * 何を: ルール登録リクエストの入力を表す
 * なぜ: Bean Validation で不正な入力をサービス層の手前で弾くため
 */
package com.example.ttl.api;

import com.example.ttl.model.RuleRegistration;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleRegistrationRequest(
    @NotBlank(message = "collection_id is required") String collectionId,
    @NotBlank(message = "time_field is required") String timeField,
    @NotNull(message = "retention_seconds is required")
        @Min(value = 0, message = "retention_seconds must be >= 0")
        Long retentionSeconds,
    @Min(value = 1, message = "batch_size must be >= 1") Integer batchSize) {

  public RuleRegistration toRegistration() {
    return new RuleRegistration(collectionId, timeField, retentionSeconds, batchSize);
  }
}
