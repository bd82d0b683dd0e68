package com.badmintongroup.discovery.api;

public enum ApiErrorCode {
  VALIDATION_ERROR,
  NOT_FOUND,
  UPSTREAM_ERROR,
  INTERNAL_ERROR
}
