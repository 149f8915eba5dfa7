package com.quantori.rsl.api.symmetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Orbit minimization of fixed-length sequences. The canonical key of a sequence is the lexicographically smallest
 * sequence among its images under a symmetry group; two sequences are equivalent if and only if their keys are equal.
 * <p>
 * Both operations are pure and idempotent, elements are compared by their natural ordering.
 */
@UtilityClass
public final class SymmetryCanonicalizer {

  /**
   * Canonical key under the reflection group: the smaller of the sequence and its reverse. Applies to open paths
   * where only mirroring produces an equivalent sequence.
   *
   * @param sequence sequence to canonicalize
   * @param <T>      element type
   * @return an immutable canonical key
   */
  public static <T extends Comparable<? super T>> List<T> reflectCanonical(List<T> sequence) {
    List<T> reversed = new ArrayList<>(sequence);
    Collections.reverse(reversed);
    return List.copyOf(min(sequence, reversed));
  }

  /**
   * Canonical key under the dihedral group of order {@code 2n}: the smallest sequence among all rotations of the
   * sequence and all rotations of its reverse. Applies to closed rings.
   *
   * @param sequence sequence to canonicalize
   * @param <T>      element type
   * @return an immutable canonical key
   */
  public static <T extends Comparable<? super T>> List<T> necklaceCanonical(List<T> sequence) {
    List<T> forward = new ArrayList<>(sequence);
    List<T> backward = new ArrayList<>(sequence);
    Collections.reverse(backward);
    List<T> best = sequence;
    for (int shift = 0; shift < sequence.size(); shift++) {
      best = min(best, forward);
      best = min(best, backward);
      Collections.rotate(forward, -1);
      Collections.rotate(backward, -1);
    }
    return List.copyOf(best);
  }

  /**
   * Lexicographic comparison of two sequences, a proper prefix is smaller.
   */
  public static <T extends Comparable<? super T>> int compare(List<T> left, List<T> right) {
    int length = Math.min(left.size(), right.size());
    for (int i = 0; i < length; i++) {
      int result = left.get(i).compareTo(right.get(i));
      if (result != 0) {
        return result;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  private static <T extends Comparable<? super T>> List<T> min(List<T> current, List<T> candidate) {
    return compare(candidate, current) < 0 ? new ArrayList<>(candidate) : current;
  }
}
