/*
 * どこで: Squad API
 * 何を: 入力値の業務的な不正を表現する
 * なぜ: 未対応リージョンなどを 400 応答へ変換するため
 */
package com.example.squad_announcer.api;

public class InvalidSquadRequestException extends RuntimeException {
  public InvalidSquadRequestException(String message) {
    super(message);
  }
}
