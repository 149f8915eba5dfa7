package com.quantori.rsl.core.generation;

import com.quantori.rsl.api.model.Layer;
import com.quantori.rsl.api.model.Lineage;
import com.quantori.rsl.api.render.SmartsRenderer;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Memoized ancestor patterns keyed by lineage. A lineage is rendered at most once however many of its substituent
 * assignments end up in the table. Not thread safe.
 */
public class AncestorCache {
  private final SmartsRenderer renderer;
  private final Map<Lineage, AncestorSmarts> cache = new HashMap<>();
  @Getter
  private long hits;
  @Getter
  private long misses;

  public AncestorCache(SmartsRenderer renderer) {
    this.renderer = renderer;
  }

  public AncestorSmarts get(Lineage lineage) {
    AncestorSmarts cached = cache.get(lineage);
    if (cached != null) {
      hits++;
      return cached;
    }
    misses++;
    AncestorSmarts computed = render(renderer, lineage);
    cache.put(lineage, computed);
    return computed;
  }

  public int size() {
    return cache.size();
  }

  /**
   * Renders the ancestor patterns of a lineage without any caching.
   */
  public static AncestorSmarts render(SmartsRenderer renderer, Lineage lineage) {
    return new AncestorSmarts(
        renderer.render(lineage.core(), Layer.GENERIC_RING),
        renderer.renderSkeleton(lineage.skeleton()),
        renderer.render(lineage.core(), Layer.CORE),
        renderer.render(lineage.mask(), Layer.MASK));
  }
}
