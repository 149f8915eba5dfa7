package com.quantori.rsl.api.model;

import com.quantori.rsl.api.vocabulary.AtomToken;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Skeleton closed into a ring by a center atom placed at slot 0.
 */
public record Core(AtomToken center, Skeleton skeleton) implements RingPattern {

  public Core {
    Objects.requireNonNull(center, "center");
    Objects.requireNonNull(skeleton, "skeleton");
  }

  public List<AtomToken> atoms() {
    List<AtomToken> atoms = new ArrayList<>(RING_SIZE);
    atoms.add(center);
    atoms.addAll(skeleton.atoms());
    return atoms;
  }

  @Override
  public List<Position> positions() {
    return atoms().stream().map(Position::untagged).toList();
  }
}
