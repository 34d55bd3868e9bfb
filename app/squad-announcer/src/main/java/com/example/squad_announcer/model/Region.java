/*
 * どこで: Squad ドメインモデル
 * 何を: 試合データ提供元がサポートするリージョンを定義する
 * なぜ: 登録時の region 入力を列挙型で固定するため
 */
package com.example.squad_announcer.model;

public enum Region {
  NA("na"),
  EU("eu"),
  AP("ap"),
  KR("kr"),
  LATAM("latam"),
  BR("br");

  private final String value;

  Region(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: 外部入力の region 文字列を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定し、未対応値は IllegalArgumentException を送出する。
   * 前提: null/空は呼び出し側で既定値 (NA) に置き換えること。
   */
  public static Region fromValue(String region) {
    for (Region candidate : values()) {
      if (candidate.value.equalsIgnoreCase(region)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported region: " + region);
  }
}
