/*
 * どこで: Squad サービス層
 * 何を: 告知配信の失敗を表現する
 * なぜ: 配信失敗を台帳更新なしの FAILED として扱うため
 */
package com.example.squad_announcer.service;

public class AnnouncementDeliveryException extends RuntimeException {

  public enum Reason {
    NO_TARGET,
    FORBIDDEN,
    RATE_LIMITED,
    TIMEOUT,
    UPSTREAM_ERROR
  }

  private final Reason reason;

  public AnnouncementDeliveryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AnnouncementDeliveryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
