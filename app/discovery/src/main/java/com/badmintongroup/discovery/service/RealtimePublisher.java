package com.badmintongroup.discovery.service;

/** リアルタイム通知の送出先。トランスポート (NATS など) に依存しない。 */
public interface RealtimePublisher {

  /**
   * eventName のイベントを payload 付きで送出する。
   *
   * @throws IllegalStateException 送出に失敗した場合
   */
  void publish(String eventName, Object payload);
}
