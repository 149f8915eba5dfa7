package com.quantori.rsl.core.generation;

import com.quantori.rsl.api.model.Layer;
import com.quantori.rsl.api.model.Position;
import com.quantori.rsl.api.render.SmartsRenderer;
import com.quantori.rsl.core.model.HierarchyEntry;
import java.util.List;
import java.util.Optional;

/**
 * Collapses final patterns to one entry per dihedral orbit. The first candidate seen for an orbit wins, its ancestor
 * patterns come from the lineage cache and only the substituted layer is rendered per entry.
 */
public class HierarchyAssembler {
  private final SmartsRenderer renderer;
  private final AncestorCache ancestors;
  private final FirstSeenIndex<List<Position>, HierarchyEntry> entries = new FirstSeenIndex<>();
  private long candidates;

  public HierarchyAssembler(SmartsRenderer renderer) {
    this.renderer = renderer;
    this.ancestors = new AncestorCache(renderer);
  }

  /**
   * Accepts a candidate.
   *
   * @return the new entry, or empty if an equivalent pattern was accepted before
   */
  public Optional<HierarchyEntry> accept(FinalCandidate candidate) {
    candidates++;
    List<Position> key = SubstituentGenerator.canonicalKey(candidate.pattern());
    if (entries.contains(key)) {
      return Optional.empty();
    }
    HierarchyEntry entry = new HierarchyEntry(
        key,
        candidate.lineage(),
        candidate.pattern(),
        ancestors.get(candidate.lineage()).toRow(renderer.render(candidate.pattern(), Layer.SUBSTITUTED)));
    entries.offer(key, entry);
    return Optional.of(entry);
  }

  public List<HierarchyEntry> entries() {
    return entries.values();
  }

  public long candidates() {
    return candidates;
  }

  public AncestorCache ancestors() {
    return ancestors;
  }
}
