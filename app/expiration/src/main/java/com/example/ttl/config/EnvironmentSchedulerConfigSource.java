/*
 * どこで: TTL スケジューラ設定
 * 何を: 稼働中の Spring Environment から ttl.scheduler を再バインドする
 * なぜ: 起動後に変更されたプロパティソースをリロードで反映するため
 */
package com.example.ttl.config;

import com.example.ttl.model.SchedulerConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EnvironmentSchedulerConfigSource implements SchedulerConfigSource {

  private final Environment environment;

  @Override
  public SchedulerConfig readConfig() {
    final TtlSchedulerProperties properties;
    try {
      properties =
          Binder.get(environment)
              .bindOrCreate(TtlSchedulerProperties.PREFIX, TtlSchedulerProperties.class);
    } catch (BindException ex) {
      throw new InvalidSchedulerConfigException(
          "failed to bind " + TtlSchedulerProperties.PREFIX + ": " + rootMessage(ex), ex);
    }
    return properties.toSchedulerConfig();
  }

  private String rootMessage(Throwable ex) {
    Throwable current = ex;
    while (current.getCause() != null) {
      current = current.getCause();
    }
    return current.getMessage();
  }
}
