/*
 * どこで: Discovery サービス層
 * 何を: 2 点間の大円距離を求め、検索半径で候補を絞り込む
 * なぜ: 空間インデックスを持たず、取得済み候補を線形に後段フィルタするため
 */
package com.badmintongroup.discovery.service;

import com.badmintongroup.discovery.model.DiscoveryFilter;
import com.badmintongroup.discovery.model.SessionRecord;
import org.springframework.stereotype.Component;

@Component
public class GeoFilterEngine {

  public static final double EARTH_RADIUS_KM = 6371.0;

  /**
   * 役割: haversine で 2 点間の距離 (km) を返す。
   * 動作: 度で受け取りラジアンへ変換して計算する。
   * 前提: 緯度は [-90, 90]、経度は [-180, 180]。範囲外は IllegalArgumentException。
   */
  public double distanceKm(double lat1, double lon1, double lat2, double lon2) {
    checkLatitude(lat1);
    checkLatitude(lat2);
    checkLongitude(lon1);
    checkLongitude(lon2);
    final double dLat = Math.toRadians(lat2 - lat1);
    final double dLon = Math.toRadians(lon2 - lon1);
    final double a =
        Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1))
                * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2)
                * Math.sin(dLon / 2);
    return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
  }

  /** 位置指定が無いか、レコードがフィルタ位置から radiusKm 以内なら true。 */
  public boolean withinRadius(SessionRecord record, DiscoveryFilter filter) {
    if (!filter.geoActive()) {
      return true;
    }
    final Double distance = distanceFrom(record, filter);
    return distance != null && distance <= filter.radiusKm();
  }

  /** 位置指定とレコード座標が揃っていれば距離、そうでなければ null。 */
  public Double distanceFrom(SessionRecord record, DiscoveryFilter filter) {
    if (!filter.geoActive() || !record.hasCoordinates()) {
      return null;
    }
    return distanceKm(
        filter.latitude(), filter.longitude(), record.latitude(), record.longitude());
  }

  private void checkLatitude(double latitude) {
    if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
  }

  private void checkLongitude(double longitude) {
    if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
  }
}
