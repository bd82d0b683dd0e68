package com.badmintongroup.discovery.model;

import java.util.List;

/** popular / nearby の結果一覧をキャッシュへ型付きで保存するための入れ物。 */
public record DiscoveryResultList(List<DiscoveryResult> sessions) {

  public DiscoveryResultList {
    sessions = List.copyOf(sessions);
  }
}
