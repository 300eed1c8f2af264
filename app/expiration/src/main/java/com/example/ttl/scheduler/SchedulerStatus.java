/*
 * どこで: TTL スケジューラ
 * 何を: スケジューラの状態スナップショットを表す
 * なぜ: 次回実行予定と直近パスの結果を 1 回の参照で返すため
 */
package com.example.ttl.scheduler;

import com.example.ttl.model.CleanupPassResult;
import com.example.ttl.model.SchedulerConfig;
import com.example.ttl.model.SchedulerState;
import java.time.Instant;

public record SchedulerStatus(
    SchedulerState state,
    SchedulerConfig config,
    Instant nextRunAt,
    long completedCycles,
    long failedCycles,
    CleanupPassResult lastPass) {}
