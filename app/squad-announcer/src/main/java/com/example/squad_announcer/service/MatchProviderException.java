/*
 * どこで: Squad サービス層
 * 何を: 試合データ提供元の呼び出し失敗を表現する
 * なぜ: リトライ可否とバックオフ判断を Reason で一貫して行うため
 */
package com.example.squad_announcer.service;

import java.time.Duration;

public class MatchProviderException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    RATE_LIMITED,
    UNAVAILABLE,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;
  private final Duration retryAfter;

  public MatchProviderException(Reason reason, String message) {
    this(reason, message, null, null);
  }

  public MatchProviderException(Reason reason, String message, Throwable cause) {
    this(reason, message, null, cause);
  }

  public MatchProviderException(
      Reason reason, String message, Duration retryAfter, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.retryAfter = retryAfter;
  }

  public Reason reason() {
    return reason;
  }

  /** 429 応答に Retry-After が付いていた場合のみ非 null。 */
  public Duration retryAfter() {
    return retryAfter;
  }
}
