/*
 * どこで: TTL データアクセス
 * 何を: 検証済みでスキーマ修飾も可能な PostgreSQL 識別子を表す
 * なぜ: ルールのテーブル名/列名は DDL/DML に埋め込むため自由文字列を通さないため
 */
package com.example.ttl.repository;

import java.util.regex.Pattern;

public record SqlIdentifier(String schema, String name) {

  // 引用符なしで書ける形の名前だけを許可する。下の quote で登録時の大小文字をそのまま保つ。
  private static final Pattern VALID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  public SqlIdentifier {
    if (schema != null) {
      requireValid(schema);
    }
    requireValid(name);
  }

  public static SqlIdentifier of(String name) {
    return new SqlIdentifier(null, name);
  }

  /** {@code name} または {@code schema.name} を解釈する。 */
  public static SqlIdentifier parseQualified(String qualified) {
    if (qualified == null) {
      throw new IllegalArgumentException("identifier is required");
    }
    final int dot = qualified.indexOf('.');
    if (dot < 0) {
      return of(qualified);
    }
    return new SqlIdentifier(qualified.substring(0, dot), qualified.substring(dot + 1));
  }

  public boolean qualified() {
    return schema != null;
  }

  public String quoted() {
    return qualified() ? quote(schema) + "." + quote(name) : quote(name);
  }

  private static String quote(String part) {
    return '"' + part + '"';
  }

  private static void requireValid(String part) {
    if (part == null || !VALID.matcher(part).matches()) {
      throw new IllegalArgumentException("invalid identifier: " + part);
    }
  }
}
