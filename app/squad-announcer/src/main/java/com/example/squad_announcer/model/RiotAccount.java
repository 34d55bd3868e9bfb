/*
 * どこで: Squad ドメインモデル
 * 何を: 試合データ提供元で確認できた Riot アカウントを表現する
 * なぜ: 登録時のアカウント実在確認結果を型で扱うため
 */
package com.example.squad_announcer.model;

public record RiotAccount(String name, String tag, String region, int accountLevel) {}
