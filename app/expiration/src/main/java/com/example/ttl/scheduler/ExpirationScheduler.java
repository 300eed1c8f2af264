/*
 * どこで: TTL スケジューラ
 * 何を: 設定間隔でクリーンアップパスを起動する単一のバックグラウンドスレッド
 * なぜ: interval と有効/無効をサービス再起動なしで変更できるようにするため
 */
package com.example.ttl.scheduler;

import com.example.ttl.config.InvalidSchedulerConfigException;
import com.example.ttl.config.SchedulerConfigSource;
import com.example.ttl.config.TtlSchedulerProperties;
import com.example.ttl.model.CleanupPassResult;
import com.example.ttl.model.PassStatus;
import com.example.ttl.model.SchedulerConfig;
import com.example.ttl.model.SchedulerState;
import com.example.ttl.repository.StoreStateRepository;
import com.example.ttl.service.CleanupPassService;
import com.example.ttl.service.ExpirationMetrics;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "collaborators are Spring managed singletons and cannot be copied")
public class ExpirationScheduler {

  private static final Logger logger = LoggerFactory.getLogger(ExpirationScheduler.class);

  private enum WakeReason {
    TIMER,
    RELOAD,
    SHUTDOWN
  }

  private final CleanupPassService cleanupPassService;
  private final StoreStateRepository storeStateRepository;
  private final SchedulerConfigSource configSource;
  private final ExpirationMetrics metrics;
  private final TtlSchedulerProperties properties;
  private final Clock clock;
  private final ThreadFactory threadFactory;
  private final AtomicReference<SchedulerConfig> config;
  private final AtomicReference<SchedulerState> state;
  private final AtomicBoolean started;
  private final AtomicLong completedCycles = new AtomicLong();
  private final AtomicLong failedCycles = new AtomicLong();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition wakeUp = lock.newCondition();
  // lock で保護
  private boolean reloadRequested;
  // 自分が現在の worker である間だけループを続ける。stop() がこのフィールドを消す。
  private volatile Thread worker;
  private volatile Instant nextRunAt;

  public ExpirationScheduler(
      CleanupPassService cleanupPassService,
      StoreStateRepository storeStateRepository,
      SchedulerConfigSource configSource,
      ExpirationMetrics metrics,
      TtlSchedulerProperties properties,
      Clock clock) {
    this.cleanupPassService = cleanupPassService;
    this.storeStateRepository = storeStateRepository;
    this.configSource = configSource;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
    this.threadFactory =
        new ThreadFactoryBuilder().setNameFormat("ttl-scheduler-%d").setDaemon(true).build();
    this.config = new AtomicReference<>(properties.toSchedulerConfig());
    this.state = new AtomicReference<>(SchedulerState.IDLE);
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void autoStart() {
    if (properties.autoStart()) {
      start();
    }
  }

  public synchronized void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    final Thread thread = threadFactory.newThread(this::runLoop);
    worker = thread;
    thread.start();
    logger.info(
        "ttl scheduler started interval={} enabled={}",
        config.get().interval(),
        config.get().enabled());
  }

  /** ループを停止し、設定された shutdown timeout まで終了を待つ。 */
  @PreDestroy
  public synchronized void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    final Thread current = worker;
    state.set(SchedulerState.STOPPING);
    lock.lock();
    try {
      worker = null;
      wakeUp.signalAll();
    } finally {
      lock.unlock();
    }
    if (current == null) {
      return;
    }
    try {
      current.join(properties.shutdownTimeout().toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (current.isAlive()) {
      logger.warn(
          "ttl scheduler did not stop within {}, interrupting thread={}",
          properties.shutdownTimeout(),
          current.getName());
      current.interrupt();
    } else {
      logger.info("ttl scheduler stopped");
    }
  }

  /**
   * 役割:
   * - スケジューラ設定を読み直し、妥当なら差し替える。
   * - 実行中の待機は新しい interval でやり直す。パスは起動しない。
   *
   * @throws InvalidSchedulerConfigException 新しい設定を拒否した場合。直前の設定が有効なまま残る
   */
  public SchedulerConfig reloadConfig() {
    final SchedulerConfig next;
    try {
      next = configSource.readConfig();
    } catch (InvalidSchedulerConfigException ex) {
      metrics.recordConfigReload(false);
      logger.warn("ttl scheduler config rejected, keeping {}: {}", config.get(), ex.getMessage());
      throw ex;
    }
    final SchedulerConfig previous = config.getAndSet(next);
    metrics.recordConfigReload(true);
    logger.info("ttl scheduler config reloaded previous={} current={}", previous, next);
    lock.lock();
    try {
      reloadRequested = true;
      wakeUp.signalAll();
    } finally {
      lock.unlock();
    }
    return next;
  }

  public SchedulerStatus status() {
    return new SchedulerStatus(
        state.get(),
        config.get(),
        started.get() ? nextRunAt : null,
        completedCycles.get(),
        failedCycles.get(),
        cleanupPassService.lastResult().orElse(null));
  }

  public SchedulerConfig currentConfig() {
    return config.get();
  }

  @VisibleForTesting
  boolean isRunning() {
    final Thread current = worker;
    return current != null && current.isAlive();
  }

  private void runLoop() {
    final Thread self = Thread.currentThread();
    try {
      while (isCurrent(self)) {
        final WakeReason reason;
        try {
          reason = awaitWakeUp(self);
        } catch (RuntimeException ex) {
          // 待機中の想定外エラーでもループは止めない。次の待機で同じ設定を読み直す。
          failedCycles.incrementAndGet();
          logger.error("ttl scheduler wait failed, retrying", ex);
          continue;
        }
        switch (reason) {
          case TIMER -> runCycle(self);
          case RELOAD -> {
            state.set(SchedulerState.RELOADING);
            logger.debug("ttl scheduler restarting wait interval={}", config.get().interval());
          }
          case SHUTDOWN -> {
            return;
          }
        }
      }
    } finally {
      if (worker == self) {
        // stop() 以外で抜けた。割り込みか Error がサイクルから漏れた。
        logger.warn("ttl scheduler loop exited without stop request");
        worker = null;
        started.set(false);
      }
      if (worker == null) {
        nextRunAt = null;
        state.set(SchedulerState.STOPPED);
      }
    }
  }

  private WakeReason awaitWakeUp(Thread self) {
    // 待機ごとに 1 スナップショット。リロードで起こされた次の待機が新しい interval を使う。
    final SchedulerConfig snapshot = config.get();
    long remainingNanos = snapshot.interval().toNanos();
    nextRunAt = Instant.now(clock).plus(snapshot.interval());
    lock.lock();
    try {
      if (isCurrent(self)) {
        state.set(SchedulerState.WAITING);
      }
      while (true) {
        if (!isCurrent(self)) {
          return WakeReason.SHUTDOWN;
        }
        if (reloadRequested) {
          reloadRequested = false;
          return WakeReason.RELOAD;
        }
        if (remainingNanos <= 0) {
          return WakeReason.TIMER;
        }
        remainingNanos = wakeUp.awaitNanos(remainingNanos);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return WakeReason.SHUTDOWN;
    } finally {
      lock.unlock();
    }
  }

  private void runCycle(Thread self) {
    final SchedulerConfig snapshot = config.get();
    if (!snapshot.enabled()) {
      logger.debug("ttl scheduler tick skipped, disabled");
      return;
    }
    state.set(SchedulerState.RUNNING);
    try {
      if (storeStateRepository.isInRecovery()) {
        logger.debug("ttl scheduler tick skipped, store is in recovery");
        return;
      }
      final CleanupPassResult result = cleanupPassService.runOnePass(() -> !isCurrent(self));
      if (result.status() == PassStatus.FAILED) {
        failedCycles.incrementAndGet();
      } else {
        completedCycles.incrementAndGet();
      }
    } catch (RuntimeException ex) {
      failedCycles.incrementAndGet();
      logger.error("ttl scheduler cycle failed", ex);
    }
  }

  private boolean isCurrent(Thread self) {
    return worker == self;
  }
}
