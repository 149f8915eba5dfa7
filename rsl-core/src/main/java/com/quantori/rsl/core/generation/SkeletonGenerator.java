package com.quantori.rsl.core.generation;

import com.quantori.rsl.api.model.Skeleton;
import com.quantori.rsl.api.symmetry.SymmetryCanonicalizer;
import com.quantori.rsl.api.vocabulary.AtomToken;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Layer 1 and 2: ring paths over the two-symbol skeleton alphabet, unique up to mirroring.
 */
@Slf4j
public class SkeletonGenerator {
  private final Vocabulary vocabulary;

  public SkeletonGenerator(Vocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  /**
   * Enumerates every skeleton with at most the allowed number of nitrogen-like symbols, keeping the first skeleton
   * generated for each reflection orbit.
   *
   * @return skeletons in generation order
   */
  public List<Skeleton> generate() {
    List<List<AtomToken>> candidates = Combinatorics.product(vocabulary.getSkeletonAlphabet(), Skeleton.LENGTH);
    FirstSeenIndex<List<AtomToken>, Skeleton> unique = new FirstSeenIndex<>();
    candidates.stream()
        .map(Skeleton::new)
        .filter(this::isAllowed)
        .forEach(skeleton -> unique.offer(canonicalKey(skeleton), skeleton));
    log.debug("Skeletons: {} candidates, {} allowed, {} unique",
        candidates.size(), unique.offered(), unique.size());
    return unique.values();
  }

  public boolean isAllowed(Skeleton skeleton) {
    return skeleton.count(vocabulary.getNitrogenLike()) <= vocabulary.getMaxNitrogenLike();
  }

  public static List<AtomToken> canonicalKey(Skeleton skeleton) {
    return SymmetryCanonicalizer.reflectCanonical(skeleton.atoms());
  }
}
