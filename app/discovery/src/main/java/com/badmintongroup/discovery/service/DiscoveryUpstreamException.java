/*
 * どこで: Discovery サービス層
 * 何を: セッションストアへの問い合わせ失敗を表現する
 * なぜ: DB 障害やタイムアウトを 500 UPSTREAM_ERROR へ正規化するため
 */
package com.badmintongroup.discovery.service;

public class DiscoveryUpstreamException extends RuntimeException {
  public DiscoveryUpstreamException(String operation, Throwable cause) {
    super("session store query failed: " + operation, cause);
  }
}
