/*
 * どこで: TTL 設定バインド
 * 何を: ttl.scheduler 配下のスケジューラ設定を保持する
 * なぜ: interval と有効/無効は環境ごとに運用し、実行中にリロードするため
 */
package com.example.ttl.config;

import com.example.ttl.model.SchedulerConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = TtlSchedulerProperties.PREFIX)
public record TtlSchedulerProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("60s") Duration interval,
    @DefaultValue("true") boolean autoStart,
    @DefaultValue("30s") Duration shutdownTimeout) {

  public static final String PREFIX = "ttl.scheduler";

  public SchedulerConfig toSchedulerConfig() {
    return SchedulerConfig.of(interval, enabled);
  }
}
