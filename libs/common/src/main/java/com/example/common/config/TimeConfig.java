/*
 * どこで: 共通設定
 * 何を: アプリケーションの Clock を Bean として公開する
 * なぜ: 失効 cutoff と統計時刻をテストで再現可能にするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
