/*
 * どこで: Squad サービス層
 * 何を: 再配信しても回復しない presence イベント処理失敗を示す例外
 * なぜ: NATS 再配信を止めて破棄する判断に使うため
 */
package com.example.squad_announcer.service;

public class PresenceEventPermanentException extends RuntimeException {

  public PresenceEventPermanentException(String message) {
    super(message);
  }

  public PresenceEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
