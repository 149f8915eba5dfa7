package com.quantori.rsl.core.generation;

import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Enumeration helpers. Results are produced in lexicographic order of element indexes, the last slot varying
 * fastest.
 */
@UtilityClass
public final class Combinatorics {

  /**
   * Cartesian product of {@code choices} with itself, {@code repeat} times. A zero repeat yields a single empty tuple.
   */
  public static <T> List<List<T>> product(List<T> choices, int repeat) {
    if (repeat < 0) {
      throw new IllegalArgumentException("Repeat must not be negative: " + repeat);
    }
    List<List<T>> result = new ArrayList<>();
    if (repeat > 0 && choices.isEmpty()) {
      return result;
    }
    int[] indexes = new int[repeat];
    while (true) {
      List<T> tuple = new ArrayList<>(repeat);
      for (int index : indexes) {
        tuple.add(choices.get(index));
      }
      result.add(List.copyOf(tuple));

      int slot = repeat - 1;
      while (slot >= 0 && indexes[slot] == choices.size() - 1) {
        indexes[slot] = 0;
        slot--;
      }
      if (slot < 0) {
        return result;
      }
      indexes[slot]++;
    }
  }

  /**
   * All {@code k}-element subsets of {@code items}, each keeping the order of {@code items}.
   */
  public static <T> List<List<T>> combinations(List<T> items, int k) {
    List<List<T>> result = new ArrayList<>();
    if (k < 0 || k > items.size()) {
      return result;
    }
    int[] indexes = new int[k];
    for (int i = 0; i < k; i++) {
      indexes[i] = i;
    }
    while (true) {
      List<T> subset = new ArrayList<>(k);
      for (int index : indexes) {
        subset.add(items.get(index));
      }
      result.add(List.copyOf(subset));

      int slot = k - 1;
      while (slot >= 0 && indexes[slot] == items.size() - k + slot) {
        slot--;
      }
      if (slot < 0) {
        return result;
      }
      indexes[slot]++;
      for (int i = slot + 1; i < k; i++) {
        indexes[i] = indexes[i - 1] + 1;
      }
    }
  }
}
