package com.quantori.rsl.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Comparator;

/**
 * One row of the hierarchical library: rendered patterns of the five layers.
 */
@JsonPropertyOrder({"layer1_smarts", "layer2_smarts", "layer3_smarts", "layer4_smarts", "layer5_smarts"})
public record HierarchyRow(
    @JsonProperty("layer1_smarts") String layer1,
    @JsonProperty("layer2_smarts") String layer2,
    @JsonProperty("layer3_smarts") String layer3,
    @JsonProperty("layer4_smarts") String layer4,
    @JsonProperty("layer5_smarts") String layer5) implements Comparable<HierarchyRow> {

  private static final Comparator<HierarchyRow> ORDER = Comparator.comparing(HierarchyRow::layer1)
      .thenComparing(HierarchyRow::layer2)
      .thenComparing(HierarchyRow::layer3)
      .thenComparing(HierarchyRow::layer4)
      .thenComparing(HierarchyRow::layer5);

  public String layer(Layer layer) {
    return switch (layer) {
      case GENERIC_RING -> layer1;
      case SKELETON -> layer2;
      case CORE -> layer3;
      case MASK -> layer4;
      case SUBSTITUTED -> layer5;
    };
  }

  @Override
  public int compareTo(HierarchyRow other) {
    return ORDER.compare(this, other);
  }
}
