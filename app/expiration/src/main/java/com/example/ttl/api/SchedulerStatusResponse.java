package com.example.ttl.api;

import com.example.ttl.model.SchedulerState;
import com.example.ttl.scheduler.SchedulerStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SchedulerStatusResponse(
    SchedulerState state,
    boolean enabled,
    long intervalSeconds,
    Instant nextRunAt,
    long completedCycles,
    long failedCycles,
    CleanupPassResponse lastPass) {

  public static SchedulerStatusResponse from(SchedulerStatus status) {
    return new SchedulerStatusResponse(
        status.state(),
        status.config().enabled(),
        status.config().intervalSeconds(),
        status.nextRunAt(),
        status.completedCycles(),
        status.failedCycles(),
        CleanupPassResponse.from(status.lastPass()));
  }
}
