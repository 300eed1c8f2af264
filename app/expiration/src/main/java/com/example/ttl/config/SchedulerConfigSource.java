package com.example.ttl.config;

import com.example.ttl.model.SchedulerConfig;

/** スケジューラ設定の正本。起動時とリロードのたびに読み出される。 */
public interface SchedulerConfigSource {

  SchedulerConfig readConfig();
}
