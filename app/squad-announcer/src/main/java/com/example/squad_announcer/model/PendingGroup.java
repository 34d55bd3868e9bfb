/*
 * どこで: Squad ドメインモデル
 * 何を: デバウンス窓の途中にある候補 squad を保持する
 * なぜ: 窓の延長ルール (GROUP_WAIT_TIME ごとの延長と最大待機の上限) を一箇所に閉じ込めるため
 */
package com.example.squad_announcer.model;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** テナントロック下でのみ操作される。 */
public final class PendingGroup {

  private final GroupKey key;
  private final Instant createdAt;
  private final Map<String, SessionEnded> members = new LinkedHashMap<>();
  private Instant deadline;

  public PendingGroup(GroupKey key, Instant createdAt, Duration waitTime) {
    this.key = key;
    this.createdAt = createdAt;
    this.deadline = createdAt.plus(waitTime);
  }

  /**
   * 役割: メンバーを追加し締切を延長する。
   * 動作: 締切は now + waitTime へ押し出すが createdAt + maxWait を超えない。既存メンバーは最新の終了情報で上書きする。
   * 前提: 呼び出し側が締切前であることを確認済み。
   */
  public Instant add(SessionEnded event, Instant now, Duration waitTime, Duration maxWait) {
    members.put(event.userId(), event);
    final Instant extended = now.plus(waitTime);
    final Instant cap = createdAt.plus(maxWait);
    final Instant next = extended.isAfter(cap) ? cap : extended;
    if (next.isAfter(deadline)) {
      deadline = next;
    }
    return deadline;
  }

  public boolean expiredAt(Instant now) {
    return !now.isBefore(deadline);
  }

  public GroupKey key() {
    return key;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant deadline() {
    return deadline;
  }

  public int size() {
    return members.size();
  }

  public List<SessionEnded> members() {
    return List.copyOf(members.values());
  }
}
