package com.quantori.rsl.core.generation;

import com.quantori.rsl.api.model.Core;
import com.quantori.rsl.api.model.Lineage;
import com.quantori.rsl.api.model.Position;
import com.quantori.rsl.api.model.Skeleton;
import com.quantori.rsl.api.render.SmartsRenderer;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import com.quantori.rsl.core.model.GenerationResult;
import com.quantori.rsl.core.model.GenerationStatistics;
import com.quantori.rsl.core.model.HierarchyTable;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs all generation stages in the calling thread. Every stage consumes the deduplicated output of the previous one.
 */
@Slf4j
@Getter
public class HierarchyGenerator {
  private final SmartsRenderer renderer;
  private final SkeletonGenerator skeletonGenerator;
  private final CoreMaskGenerator coreMaskGenerator;
  private final SubstituentGenerator substituentGenerator;

  public HierarchyGenerator(Vocabulary vocabulary) {
    this.renderer = new SmartsRenderer(vocabulary);
    this.skeletonGenerator = new SkeletonGenerator(vocabulary);
    this.coreMaskGenerator = new CoreMaskGenerator(vocabulary);
    this.substituentGenerator = new SubstituentGenerator(vocabulary);
  }

  public List<Core> cores(List<Skeleton> skeletons) {
    return skeletons.stream()
        .flatMap(skeleton -> coreMaskGenerator.coresOf(skeleton).stream())
        .toList();
  }

  /**
   * Masks of all cores, one lineage per dihedral orbit of the mask. The first lineage generated for an orbit is kept.
   */
  public FirstSeenIndex<List<Position>, Lineage> uniqueMasks(List<Core> cores) {
    FirstSeenIndex<List<Position>, Lineage> masks = new FirstSeenIndex<>();
    for (Core core : cores) {
      for (Lineage lineage : coreMaskGenerator.masksOf(core)) {
        masks.offer(CoreMaskGenerator.canonicalKey(lineage.mask()), lineage);
      }
    }
    return masks;
  }

  public GenerationResult generate() {
    List<Skeleton> skeletons = skeletonGenerator.generate();
    List<Core> cores = cores(skeletons);
    FirstSeenIndex<List<Position>, Lineage> masks = uniqueMasks(cores);
    log.debug("Masks: {} candidates, {} unique", masks.offered(), masks.size());

    HierarchyAssembler assembler = new HierarchyAssembler(renderer);
    for (Lineage lineage : masks.values()) {
      substituentGenerator.expand(lineage).forEach(assembler::accept);
    }
    HierarchyTable table = HierarchyTable.assemble(assembler.entries());

    GenerationStatistics statistics = GenerationStatistics.builder()
        .skeletons(skeletons.size())
        .cores(cores.size())
        .candidateMasks(masks.offered())
        .uniqueMasks(masks.size())
        .candidatePatterns(assembler.candidates())
        .rows(table.size())
        .ancestorCacheHits(assembler.ancestors().getHits())
        .ancestorCacheMisses(assembler.ancestors().getMisses())
        .build();
    log.info("Generated {} unique substructures from {} unique masks", table.size(), masks.size());
    return new GenerationResult(table, statistics);
  }
}
