package com.badmintongroup.discovery.model;

public enum SessionLifecycleEventType {
  SESSION_CREATED,
  SESSION_UPDATED,
  SESSION_TERMINATED,
  SESSION_REACTIVATED;

  public static SessionLifecycleEventType fromValue(String value) {
    for (SessionLifecycleEventType type : values()) {
      if (type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported event_type: " + value);
  }
}
