/*
 * どこで: Squad API
 * 何を: テナント内の未登録ユーザーを表現する
 * なぜ: 登録解除/統計照会の 404 応答へ変換するため
 */
package com.example.squad_announcer.api;

public class RegistrationNotFoundException extends RuntimeException {
  public RegistrationNotFoundException(String tenantId, String userId) {
    super("registration not found: " + tenantId + "/" + userId);
  }
}
