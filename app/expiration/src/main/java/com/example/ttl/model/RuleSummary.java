package com.example.ttl.model;

import java.time.Duration;

/**
 * ルールと、最後に成功した実行からの経過時間の組。
 *
 * <p>一度も実行されていないルールの {@code timeSinceLastRun} は null。
 */
public record RuleSummary(ExpirationRule rule, Duration timeSinceLastRun) {}
