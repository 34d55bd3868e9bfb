/*
 * どこで: Squad ドメインモデル
 * 何を: 試合データ取得の失敗分類を定義する
 * なぜ: 再試行可否と squad からの除外理由を型で区別するため
 */
package com.example.squad_announcer.model;

public enum FetchFailure {
  NOT_FOUND(false, DropReason.NOT_FOUND),
  RATE_LIMITED(true, DropReason.RATE_LIMITED),
  UNAVAILABLE(true, DropReason.UNAVAILABLE),
  MODE_EXCLUDED(false, DropReason.MODE_EXCLUDED);

  private final boolean transientFailure;
  private final DropReason dropReason;

  FetchFailure(boolean transientFailure, DropReason dropReason) {
    this.transientFailure = transientFailure;
    this.dropReason = dropReason;
  }

  /** SquadResolver が 1 回だけ再取得する対象かどうか。 */
  public boolean transientFailure() {
    return transientFailure;
  }

  public DropReason dropReason() {
    return dropReason;
  }
}
