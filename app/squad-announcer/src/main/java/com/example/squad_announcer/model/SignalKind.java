/*
 * どこで: Squad ドメインモデル
 * 何を: presence 収集側から届く信号の種類を定義する
 * なぜ: ワイヤ上の文字列を状態機械の入力へ固定するため
 */
package com.example.squad_announcer.model;

public enum SignalKind {
  STARTED,
  STOPPED,
  VOICE_CHANGED;

  public static SignalKind fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("signal kind is required");
    }
    for (SignalKind kind : values()) {
      if (kind.name().equalsIgnoreCase(value.trim())) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unsupported signal kind: " + value);
  }
}
