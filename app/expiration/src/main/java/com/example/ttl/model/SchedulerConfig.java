/*
 * どこで: TTL スケジューラモデル
 * 何を: リロード可能なスケジューラ設定の不変スナップショットを表す
 * なぜ: ループは待機ごとに 1 スナップショットを読み、リロードはそれを原子的に差し替えるため
 */
package com.example.ttl.model;

import com.example.ttl.config.InvalidSchedulerConfigException;
import java.time.Duration;

public record SchedulerConfig(long intervalSeconds, boolean enabled) {

  public static final long MIN_INTERVAL_SECONDS = 1;
  public static final long DEFAULT_INTERVAL_SECONDS = 60;
  // 待機はナノ秒で扱うため、long 溢れよりも十分手前の 30 日を上限にする。
  public static final long MAX_INTERVAL_SECONDS = Duration.ofDays(30).toSeconds();

  public SchedulerConfig {
    if (intervalSeconds < MIN_INTERVAL_SECONDS) {
      throw new InvalidSchedulerConfigException(
          "interval must be at least "
              + MIN_INTERVAL_SECONDS
              + "s but was "
              + intervalSeconds
              + "s");
    }
    if (intervalSeconds > MAX_INTERVAL_SECONDS) {
      throw new InvalidSchedulerConfigException(
          "interval must be at most "
              + MAX_INTERVAL_SECONDS
              + "s but was "
              + intervalSeconds
              + "s");
    }
  }

  public static SchedulerConfig of(Duration interval, boolean enabled) {
    if (interval == null) {
      throw new InvalidSchedulerConfigException("interval is required");
    }
    return new SchedulerConfig(interval.toSeconds(), enabled);
  }

  public Duration interval() {
    return Duration.ofSeconds(intervalSeconds);
  }
}
