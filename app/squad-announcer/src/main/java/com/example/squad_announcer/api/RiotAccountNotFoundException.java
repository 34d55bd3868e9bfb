/*
 * どこで: Squad API
 * 何を: 登録しようとした Riot ID が提供元に存在しないことを表現する
 * なぜ: 登録 API の 404 応答へ変換するため
 */
package com.example.squad_announcer.api;

public class RiotAccountNotFoundException extends RuntimeException {
  public RiotAccountNotFoundException(String riotId) {
    super("riot account not found: " + riotId);
  }
}
