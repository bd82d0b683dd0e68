/*
 * どこで: Discovery API
 * 何を: 検索対象として公開されていないセッションを表現する
 * なぜ: 存在しない/終了済みのセッションを 404 応答へ変換するため
 */
package com.badmintongroup.discovery.api;

public class SessionNotFoundException extends RuntimeException {
  public SessionNotFoundException(String sessionId) {
    super("Session not found or not available for discovery: " + sessionId);
  }
}
