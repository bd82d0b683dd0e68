/*
 * どこで: Discovery サービス層
 * 何を: セッション変更通知を InvalidationBus の呼び出しへ変換する
 * なぜ: Session サブシステムが直接呼び出せない場合も NATS 経由でキャッシュを整合させるため
 */
package com.badmintongroup.discovery.service;

import com.badmintongroup.discovery.model.SessionLifecycleEventType;
import com.badmintongroup.discovery.model.SessionLifecycleMessage;
import com.badmintongroup.discovery.model.SessionRecord;
import com.badmintongroup.discovery.repository.SessionCandidateRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionLifecycleEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleEventHandler.class);

  private final SessionCandidateRepository repository;
  private final InvalidationBus invalidationBus;

  /**
   * 役割: 1 件の変更通知を処理する。
   * 動作: 終了通知はそのまま bus へ渡し、それ以外は最新のレコードを読み直して bus へ渡す。
   * 前提: ストア障害は DataAccessException のまま送出し、呼び出し側で再配信させる。
   */
  public void handle(SessionLifecycleMessage message) {
    if (message.sessionId() == null || message.sessionId().isBlank()) {
      throw new SessionLifecycleEventPermanentException("session_id is required");
    }
    final SessionLifecycleEventType type;
    try {
      type = SessionLifecycleEventType.fromValue(message.eventType());
    } catch (IllegalArgumentException ex) {
      throw new SessionLifecycleEventPermanentException(ex.getMessage(), ex);
    }
    final boolean hasTraceId = message.traceId() != null && !message.traceId().isBlank();
    if (hasTraceId) {
      MDC.put("trace_id", message.traceId());
    }
    try {
      dispatch(type, message);
    } finally {
      if (hasTraceId) {
        MDC.remove("trace_id");
      }
    }
  }

  private void dispatch(SessionLifecycleEventType type, SessionLifecycleMessage message) {
    if (type == SessionLifecycleEventType.SESSION_TERMINATED) {
      invalidationBus.sessionTerminated(message.sessionId(), message.shareCode());
      return;
    }
    final Optional<SessionRecord> record = repository.findById(message.sessionId());
    if (record.isEmpty()) {
      // 通知到着前に削除されたセッションは破棄だけ行う
      logger.warn(
          "session for lifecycle event not found eventType={} sessionId={}",
          type,
          message.sessionId());
      invalidationBus.purgeSession(message.sessionId());
      invalidationBus.purgeAll();
      return;
    }
    if (type == SessionLifecycleEventType.SESSION_CREATED) {
      invalidationBus.sessionCreated(record.get());
    } else if (type == SessionLifecycleEventType.SESSION_REACTIVATED) {
      invalidationBus.sessionReactivated(record.get());
    } else {
      invalidationBus.sessionUpdated(record.get());
    }
  }
}
