/*
 * どこで: Discovery サービス層
 * 何を: リアルタイム通知のイベント名と payload 形状を定義する
 * なぜ: クライアントが購読するイベント契約を 1 か所で固定するため
 */
package com.badmintongroup.discovery.service;

import com.badmintongroup.discovery.model.DiscoveryResult;
import java.time.Instant;

public final class DiscoveryEvents {

  public static final String SESSION_CREATED = "discovery:session-created";
  public static final String SESSION_UPDATED = "discovery:session-updated";
  public static final String SESSION_TERMINATED = "discovery:session-terminated";
  public static final String SESSION_REACTIVATED = "discovery:session-reactivated";

  private DiscoveryEvents() {}

  public record SessionChanged(DiscoveryResult session, Instant timestamp) {}

  public record TerminatedSession(String id, String shareCode) {}

  public record SessionTerminated(TerminatedSession session, Instant timestamp) {}
}
