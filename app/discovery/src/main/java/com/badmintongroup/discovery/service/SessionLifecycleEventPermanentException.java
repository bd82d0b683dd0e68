/*
 * どこで: Discovery サービス層
 * 何を: 再配信しても回復しないライフサイクル通知の失敗を表現する
 * なぜ: subscriber が nak ではなく term を選べるようにするため
 */
package com.badmintongroup.discovery.service;

public class SessionLifecycleEventPermanentException extends RuntimeException {
  public SessionLifecycleEventPermanentException(String message) {
    super(message);
  }

  public SessionLifecycleEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
