/*
 * どこで: Discovery API
 * 何を: クエリパラメータの検証エラーを表現する
 * なぜ: 問題のあるフィールドを全て列挙した 400 応答へ正規化するため
 */
package com.badmintongroup.discovery.api;

import java.util.List;

public class DiscoveryValidationException extends RuntimeException {

  private final List<String> errors;

  public DiscoveryValidationException(List<String> errors) {
    super("Invalid query parameters: " + String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> errors() {
    return errors;
  }
}
