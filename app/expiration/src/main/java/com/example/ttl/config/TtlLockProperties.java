/*
 * どこで: TTL 設定バインド
 * 何を: 同一 DB の全ランナーで共有する single-flight ロック名を保持する
 * なぜ: 同じ DB を向く別デプロイ同士でロック名を一致させる必要があるため
 */
package com.example.ttl.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "ttl.lock")
public record TtlLockProperties(@NotBlank @DefaultValue("ttl_expiration_runner") String name) {}
