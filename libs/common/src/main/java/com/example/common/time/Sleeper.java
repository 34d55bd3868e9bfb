/*
 * どこで: Common 時間ユーティリティ
 * 何を: 現在スレッドを一定時間ブロックする操作を抽象化する
 * なぜ: API 反映待ちやバックオフ待機をテストで実時間なしに検証するため
 */
package com.example.common.time;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

  /**
   * 役割: 指定時間だけ呼び出しスレッドを停止する。
   * 動作: 0 以下の Duration は即時に戻る。
   * 前提: 割り込まれた場合は InterruptedException を呼び出し側へ伝播する。
   */
  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleeper() {
    return duration -> {
      if (duration == null || duration.isZero() || duration.isNegative()) {
        return;
      }
      Thread.sleep(duration.toMillis());
    };
  }
}
