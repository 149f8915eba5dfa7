package com.quantori.rsl.core.generation;

import com.quantori.rsl.api.model.HierarchyRow;

/**
 * Rendered patterns of layers 1 to 4 shared by every final pattern of one lineage.
 */
public record AncestorSmarts(String layer1, String layer2, String layer3, String layer4) {

  public HierarchyRow toRow(String layer5) {
    return new HierarchyRow(layer1, layer2, layer3, layer4, layer5);
  }
}
