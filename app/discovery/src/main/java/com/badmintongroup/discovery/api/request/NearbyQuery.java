package com.badmintongroup.discovery.api.request;

public record NearbyQuery(double latitude, double longitude, double radiusKm, int limit) {}
