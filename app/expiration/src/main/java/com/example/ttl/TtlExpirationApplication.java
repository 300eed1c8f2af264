/*
 * どこで: TTL 失効エンジンのエントリポイント
 * 何を: Spring を起動し ttl.* 設定のバインドと共通 Clock の取り込みを行う
 * なぜ: スケジューラループと管理 API を対象 DB ごとに 1 プロセスで動かすため
 */
package com.example.ttl;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class TtlExpirationApplication {

  public static void main(String[] args) {
    SpringApplication.run(TtlExpirationApplication.class, args);
  }
}
