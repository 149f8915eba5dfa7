package com.quantori.rsl.api.model;

import com.quantori.rsl.api.vocabulary.AtomToken;
import java.util.List;

/**
 * Ring path without the center atom: {@value #LENGTH} plain tokens drawn from the skeleton alphabet.
 */
public record Skeleton(List<AtomToken> atoms) implements RingPattern {
  public static final int LENGTH = RING_SIZE - 1;

  public Skeleton {
    if (atoms == null || atoms.size() != LENGTH) {
      throw new IllegalArgumentException("Skeleton must contain exactly " + LENGTH + " atoms: " + atoms);
    }
    atoms = List.copyOf(atoms);
  }

  public static Skeleton of(AtomToken... atoms) {
    return new Skeleton(List.of(atoms));
  }

  public long count(AtomToken token) {
    return atoms.stream().filter(token::equals).count();
  }

  @Override
  public List<Position> positions() {
    return atoms.stream().map(Position::untagged).toList();
  }
}
