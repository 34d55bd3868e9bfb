/*
 * どこで: Squad ドメインモデル
 * 何を: 告知バッチ内の 1 メンバー (ユーザと試合成績) を表現する
 * なぜ: 告知描画と ledger 更新に必要な情報を 1 行にまとめるため
 */
package com.example.squad_announcer.model;

public record BatchMember(String userId, String riotId, PlayerStats stats, boolean streaming) {}
