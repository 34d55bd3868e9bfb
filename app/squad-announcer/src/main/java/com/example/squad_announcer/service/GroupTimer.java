/*
 * どこで: Squad サービス層
 * 何を: 待機グループごとの締切タイマーを予約/再予約する
 * なぜ: 窓の満了判定をスケジューラ実装から切り離し、テストで仮想時刻を使えるようにするため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.GroupKey;
import java.time.Instant;

public interface GroupTimer {

  /** 同じ key の既存予約は置き換える。 */
  void schedule(GroupKey key, Instant deadline, Runnable task);
}
