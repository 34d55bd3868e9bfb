/*
 * どこで: Squad サービス層
 * 何を: 告知バッチ配信の抽象化インターフェース
 * なぜ: Discord 実送信とローカル/テスト差し替えを容易にするため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.AnnouncementBatch;

public interface AnnouncementSender {

  /** 配信できなかった場合は AnnouncementDeliveryException を送出する。 */
  void send(AnnouncementBatch batch);
}
