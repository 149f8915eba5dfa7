package com.quantori.rsl.api.model;

import java.util.Objects;

/**
 * The (skeleton, core, mask) triple a final pattern descends from. Used as a value key for ancestor patterns.
 */
public record Lineage(Skeleton skeleton, Core core, Mask mask) {

  public Lineage {
    Objects.requireNonNull(skeleton, "skeleton");
    Objects.requireNonNull(core, "core");
    Objects.requireNonNull(mask, "mask");
  }
}
