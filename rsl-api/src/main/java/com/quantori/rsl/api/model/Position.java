package com.quantori.rsl.api.model;

import com.quantori.rsl.api.vocabulary.AtomToken;
import java.util.Comparator;
import java.util.Objects;

/**
 * One ring slot: the atom token and its tag.
 */
public record Position(AtomToken token, Tag tag) implements Comparable<Position> {

  private static final Comparator<Position> ORDER =
      Comparator.comparing(Position::token).thenComparing(Position::tag);

  public Position {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(tag, "tag");
  }

  public static Position untagged(AtomToken token) {
    return new Position(token, Tag.UNSET);
  }

  public Position withTag(Tag newTag) {
    return new Position(token, newTag);
  }

  @Override
  public int compareTo(Position other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return token + "|" + tag;
  }
}
