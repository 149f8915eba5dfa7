package com.quantori.rsl.api.model;

import java.util.List;

/**
 * Fully specified ring: every open position of a mask replaced by a catalog substituent.
 */
public record FinalPattern(List<Position> positions) implements RingPattern {

  public FinalPattern {
    if (positions == null || positions.size() != RING_SIZE) {
      throw new IllegalArgumentException(
          "Final pattern must contain exactly " + RING_SIZE + " positions: " + positions);
    }
    if (positions.stream().anyMatch(position -> position.tag().is(Tag.Kind.OPEN))) {
      throw new IllegalArgumentException("Final pattern must not have open positions: " + positions);
    }
    positions = List.copyOf(positions);
  }
}
