/*
 * どこで: TTL 設定バインド
 * 何を: ttl.deletion 配下のバッチ削除チューニング値を保持する
 * なぜ: バッチ間の待機やエラー文字列の切り詰め長は環境ごとに調整するため
 */
package com.example.ttl.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "ttl.deletion")
public record TtlDeletionProperties(
    @NotNull @DefaultValue("10ms") Duration batchPause,
    @Min(1) @DefaultValue("1000") int errorMessageMaxLength) {}
