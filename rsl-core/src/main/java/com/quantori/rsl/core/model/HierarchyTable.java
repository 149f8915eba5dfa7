package com.quantori.rsl.core.model;

import com.quantori.rsl.api.model.HierarchyRow;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Final library table: one entry per final pattern orbit, sorted by the rendered patterns of layers 1 to 5.
 */
public final class HierarchyTable {
  private final List<HierarchyEntry> entries;

  private HierarchyTable(List<HierarchyEntry> entries) {
    this.entries = entries;
  }

  /**
   * Builds a table with an ordering that does not depend on the order of {@code entries}.
   */
  public static HierarchyTable assemble(Collection<HierarchyEntry> entries) {
    return new HierarchyTable(entries.stream()
        .sorted(Comparator.comparing(HierarchyEntry::row))
        .toList());
  }

  public List<HierarchyEntry> getEntries() {
    return entries;
  }

  public List<HierarchyRow> getRows() {
    return entries.stream().map(HierarchyEntry::row).toList();
  }

  public int size() {
    return entries.size();
  }
}
