package com.quantori.rsl.api.model;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Ordered sequence of ring positions, slot 0 being the ring-closure anchor.
 */
public interface RingPattern {
  /**
   * Number of atoms in the ring.
   */
  int RING_SIZE = 5;

  List<Position> positions();

  default int size() {
    return positions().size();
  }

  /**
   * Indexes of the positions whose tag is of the given kind, in ascending order.
   */
  default List<Integer> indexesOf(Tag.Kind kind) {
    List<Position> positions = positions();
    return IntStream.range(0, positions.size())
        .filter(i -> positions.get(i).tag().is(kind))
        .boxed()
        .toList();
  }
}
