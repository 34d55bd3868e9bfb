/*
 * どこで: Squad サービス層
 * 何を: 窓が満了した待機グループの受け渡し先
 * なぜ: GroupCollector を解決処理の実行方式から切り離すため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.FinalizedGroup;

public interface GroupFinalizedListener {
  void onGroupFinalized(FinalizedGroup group);
}
