package com.quantori.rsl.core.model;

import lombok.Value;

@Value
public class GenerationResult {
  HierarchyTable table;
  GenerationStatistics statistics;
}
