package com.quantori.rsl.api.model;

import java.util.List;

/**
 * Core whose marker-bearing positions are resolved to either open-wildcard or hydrogen-cap.
 */
public record Mask(List<Position> positions) implements RingPattern {

  public Mask {
    if (positions == null || positions.size() != RING_SIZE) {
      throw new IllegalArgumentException("Mask must contain exactly " + RING_SIZE + " positions: " + positions);
    }
    if (positions.stream().anyMatch(position -> position.tag().is(Tag.Kind.SUBSTITUENT))) {
      throw new IllegalArgumentException("Mask must not carry substituents: " + positions);
    }
    positions = List.copyOf(positions);
  }

  public List<Integer> openPositions() {
    return indexesOf(Tag.Kind.OPEN);
  }
}
