package com.quantori.rsl.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counts of the items produced by every generation stage.
 */
@Value
@Builder
public class GenerationStatistics {
  int skeletons;
  int cores;
  long candidateMasks;
  int uniqueMasks;
  long candidatePatterns;
  int rows;
  long ancestorCacheHits;
  long ancestorCacheMisses;
}
