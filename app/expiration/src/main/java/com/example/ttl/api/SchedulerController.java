/*
 * どこで: TTL 管理 API
 * 何を: スケジューラの状態参照と起動/停止/リロードを提供する
 * なぜ: 運用中に interval や有効/無効を再起動なしで切り替えるため
 */
package com.example.ttl.api;

import com.example.ttl.scheduler.ExpirationScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/ttl/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

  private final ExpirationScheduler scheduler;

  @GetMapping
  public SchedulerStatusResponse status() {
    return SchedulerStatusResponse.from(scheduler.status());
  }

  @PostMapping("/start")
  public SchedulerStatusResponse start() {
    scheduler.start();
    return status();
  }

  @PostMapping("/stop")
  public SchedulerStatusResponse stop() {
    scheduler.stop();
    return status();
  }

  /**
   * 役割:
   * - ttl.scheduler.* を読み直して反映する。
   * - 不正な設定は 422 を返し、直前の設定を維持する。
   */
  @PostMapping("/reload")
  public SchedulerStatusResponse reload() {
    scheduler.reloadConfig();
    return status();
  }
}
