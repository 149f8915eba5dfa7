package com.quantori.rsl.core.generation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered map which keeps the first value offered for a key and ignores later ones.
 *
 * @param <K> key type, must have structural equality
 * @param <V> value type
 */
public class FirstSeenIndex<K, V> {
  private final Map<K, V> values = new LinkedHashMap<>();
  private long offered;

  /**
   * Offers a value for a key.
   *
   * @return true if the key was absent and the value is kept
   */
  public boolean offer(K key, V value) {
    offered++;
    return values.putIfAbsent(key, value) == null;
  }

  public boolean contains(K key) {
    return values.containsKey(key);
  }

  public Optional<V> get(K key) {
    return Optional.ofNullable(values.get(key));
  }

  /**
   * Kept values in the order their keys were first seen.
   */
  public List<V> values() {
    return new ArrayList<>(values.values());
  }

  public int size() {
    return values.size();
  }

  public long offered() {
    return offered;
  }
}
