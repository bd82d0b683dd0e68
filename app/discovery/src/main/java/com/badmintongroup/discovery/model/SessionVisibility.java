package com.badmintongroup.discovery.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionVisibility {
  PUBLIC("public"),
  PRIVATE("private");

  private final String value;

  SessionVisibility(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
