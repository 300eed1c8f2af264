package com.example.ttl.config;

/** 不正なスケジューラ設定。直前のスナップショットは有効なまま残る。 */
public class InvalidSchedulerConfigException extends RuntimeException {

  public InvalidSchedulerConfigException(String message) {
    super(message);
  }

  public InvalidSchedulerConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
