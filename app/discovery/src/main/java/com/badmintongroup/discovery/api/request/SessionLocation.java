package com.badmintongroup.discovery.api.request;

/** 単一セッション取得時の任意の現在地。両方 null か両方指定のどちらか。 */
public record SessionLocation(Double latitude, Double longitude) {}
