package com.quantori.rsl.api.model;

/**
 * Specificity layers of the hierarchy, from the generic ring down to the fully substituted one.
 */
public enum Layer {
  /**
   * Generic five-membered aromatic ring.
   */
  GENERIC_RING(1),
  /**
   * Ring composition fixed, anchor still generic.
   */
  SKELETON(2),
  /**
   * Center atom fixed.
   */
  CORE(3),
  /**
   * Open and hydrogen-capped positions fixed.
   */
  MASK(4),
  /**
   * Every open position bears a concrete substituent.
   */
  SUBSTITUTED(5);

  private final int number;

  Layer(int number) {
    this.number = number;
  }

  public int number() {
    return number;
  }

  public static Layer of(int number) {
    for (Layer layer : values()) {
      if (layer.number == number) {
        return layer;
      }
    }
    throw new IllegalArgumentException("Unknown layer: " + number);
  }
}
