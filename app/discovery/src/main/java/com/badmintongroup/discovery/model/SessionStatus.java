package com.badmintongroup.discovery.model;

public enum SessionStatus {
  ACTIVE,
  COMPLETED,
  CANCELLED
}
