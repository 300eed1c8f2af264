/*
 * どこで: TTL ドメインモデル
 * 何を: コレクションと時刻フィールドで 1 つの失効ルールを識別する
 * なぜ: 1 つのコレクションが別フィールドで独立したルールを複数持てるようにするため
 */
package com.example.ttl.model;

import java.util.Comparator;
import java.util.Objects;

public record RuleKey(String collectionId, String timeField) implements Comparable<RuleKey> {

  private static final Comparator<RuleKey> ORDER =
      Comparator.comparing(RuleKey::collectionId).thenComparing(RuleKey::timeField);

  public RuleKey {
    Objects.requireNonNull(collectionId, "collectionId");
    Objects.requireNonNull(timeField, "timeField");
  }

  @Override
  public int compareTo(RuleKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return collectionId + "." + timeField;
  }
}
