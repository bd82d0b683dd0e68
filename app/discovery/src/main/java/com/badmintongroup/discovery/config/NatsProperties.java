/*
 * どこで: Discovery 設定
 * 何を: NATS 接続設定を保持する
 * なぜ: リアルタイム通知とライフサイクル購読の有効/無効を環境で切り替えるため
 */
package com.badmintongroup.discovery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
