package com.quantori.rsl.api.model;

import java.util.Comparator;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolution of a ring position: whether it stays as is, is capped by hydrogen, is left open for a substituent or
 * bears a concrete substituent from the catalog.
 *
 * @param kind tag kind
 * @param code substituent code for {@link Kind#SUBSTITUENT}, null otherwise
 */
public record Tag(Kind kind, String code) implements Comparable<Tag> {
  public static final Tag UNSET = new Tag(Kind.UNSET, null);
  public static final Tag HYDROGEN_CAP = new Tag(Kind.HYDROGEN_CAP, null);
  public static final Tag OPEN = new Tag(Kind.OPEN, null);

  private static final Comparator<Tag> ORDER = Comparator.comparing(Tag::kind)
      .thenComparing(Tag::code, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

  public Tag {
    if (kind == null) {
      throw new IllegalArgumentException("Tag kind must be specified");
    }
    if (kind == Kind.SUBSTITUENT && StringUtils.isBlank(code)) {
      throw new IllegalArgumentException("Substituent tag requires a substituent code");
    }
    if (kind != Kind.SUBSTITUENT && code != null) {
      throw new IllegalArgumentException("Only a substituent tag may carry a code, got " + kind);
    }
  }

  public static Tag substituent(String code) {
    return new Tag(Kind.SUBSTITUENT, code);
  }

  public boolean is(Kind other) {
    return kind == other;
  }

  @Override
  public int compareTo(Tag other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case UNSET -> "";
      case HYDROGEN_CAP -> "H";
      case OPEN -> "*";
      case SUBSTITUENT -> code;
    };
  }

  public enum Kind {
    UNSET,
    HYDROGEN_CAP,
    OPEN,
    SUBSTITUENT
  }
}
