package com.badmintongroup.discovery.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

public record DiscoveryResponse(
    List<DiscoveryResult> sessions,
    long totalCount,
    @JsonInclude(JsonInclude.Include.NON_NULL) Double searchRadius,
    DiscoveryFilter filters) {

  public DiscoveryResponse {
    sessions = List.copyOf(sessions);
  }
}
