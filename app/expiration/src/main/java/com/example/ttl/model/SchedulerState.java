/*
 * どこで: TTL スケジューラモデル
 * 何を: スケジューラループの状態を表す列挙
 * なぜ: 管理 API の status でループが何をしているかを示すため
 */
package com.example.ttl.model;

public enum SchedulerState {
  IDLE,
  WAITING,
  RUNNING,
  RELOADING,
  STOPPING,
  STOPPED
}
