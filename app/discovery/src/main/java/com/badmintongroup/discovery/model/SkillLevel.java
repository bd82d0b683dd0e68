/*
 * どこで: Discovery ドメインモデル
 * 何を: セッションの対象スキルレベルを定義する
 * なぜ: skillLevel クエリの入力値を列挙型で固定するため
 */
package com.badmintongroup.discovery.model;

public enum SkillLevel {
  BEGINNER,
  INTERMEDIATE,
  ADVANCED;

  /**
   * 役割: クエリ文字列の skillLevel を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定し、未対応値は IllegalArgumentException を送出する。
   * 前提: value は null でないことを呼び出し側で保証する。
   */
  public static SkillLevel fromValue(String value) {
    for (SkillLevel level : values()) {
      if (level.name().equalsIgnoreCase(value.trim())) {
        return level;
      }
    }
    throw new IllegalArgumentException("unsupported skillLevel: " + value);
  }
}
