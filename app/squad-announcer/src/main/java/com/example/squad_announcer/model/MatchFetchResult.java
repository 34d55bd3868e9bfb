/*
 * どこで: Squad ドメインモデル
 * 何を: 1 アカウント分の試合データ取得結果 (成功 or 失敗分類) と試行回数
 * なぜ: 例外ではなく値で失敗を返し、メンバー単位で失敗を閉じ込めるため
 */
package com.example.squad_announcer.model;

public record MatchFetchResult(MatchRecord match, FetchFailure failure, int attempts) {

  public static MatchFetchResult success(MatchRecord match, int attempts) {
    return new MatchFetchResult(match, null, attempts);
  }

  public static MatchFetchResult failed(FetchFailure failure, int attempts) {
    return new MatchFetchResult(null, failure, attempts);
  }

  public boolean succeeded() {
    return match != null;
  }
}
