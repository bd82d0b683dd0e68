package com.badmintongroup.discovery.api.request;

/** GET /discovery の生クエリパラメータ。型変換と検証は DiscoveryRequestValidator が行う。 */
public record DiscoverySearchRequest(
    String latitude,
    String longitude,
    String radius,
    String startTime,
    String endTime,
    String skillLevel,
    String minPlayers,
    String maxPlayers,
    String courtType,
    String limit,
    String offset) {}
