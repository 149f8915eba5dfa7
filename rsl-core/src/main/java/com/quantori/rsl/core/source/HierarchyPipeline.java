package com.quantori.rsl.core.source;

import akka.NotUsed;
import akka.actor.typed.ActorSystem;
import akka.stream.ActorAttributes;
import akka.stream.Supervision;
import akka.stream.javadsl.Sink;
import akka.stream.javadsl.Source;
import com.quantori.rsl.api.model.Lineage;
import com.quantori.rsl.api.model.Position;
import com.quantori.rsl.api.model.Skeleton;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import com.quantori.rsl.core.generation.CoreMaskGenerator;
import com.quantori.rsl.core.generation.FirstSeenIndex;
import com.quantori.rsl.core.generation.HierarchyAssembler;
import com.quantori.rsl.core.generation.HierarchyGenerator;
import com.quantori.rsl.core.model.GenerationResult;
import com.quantori.rsl.core.model.GenerationStatistics;
import com.quantori.rsl.core.model.HierarchyEntry;
import com.quantori.rsl.core.model.HierarchyTable;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the generation stages as one ordered stream:
 * skeletons, cores, masks deduplicated by dihedral orbit, substituent assignments and final patterns deduplicated by
 * dihedral orbit. A single ordered stream makes the first candidate of every orbit win deterministically.
 */
@Slf4j
public class HierarchyPipeline {
  private final ActorSystem<?> actorSystem;
  private final HierarchyGenerator stages;

  public HierarchyPipeline(ActorSystem<?> actorSystem, Vocabulary vocabulary) {
    this.actorSystem = actorSystem;
    this.stages = new HierarchyGenerator(vocabulary);
  }

  public CompletionStage<GenerationResult> run() {
    final var skeletons = new AtomicInteger();
    final var cores = new AtomicInteger();
    final var candidateMasks = new AtomicLong();
    final var uniqueMasks = new AtomicInteger();
    final var candidatePatterns = new AtomicLong();

    CoreMaskGenerator coreMaskGenerator = stages.getCoreMaskGenerator();
    Source<Lineage, NotUsed> masks = createSkeletonSource()
        .map(skeleton -> count(skeletons, skeleton))
        .mapConcat(coreMaskGenerator::coresOf)
        .map(core -> count(cores, core))
        .mapConcat(coreMaskGenerator::masksOf)
        .map(lineage -> count(candidateMasks, lineage))
        .<Lineage>statefulMapConcat(() -> {
          FirstSeenIndex<List<Position>, Lineage> seen = new FirstSeenIndex<>();
          return lineage -> seen.offer(CoreMaskGenerator.canonicalKey(lineage.mask()), lineage)
              ? List.of(lineage)
              : List.of();
        })
        .map(lineage -> count(uniqueMasks, lineage));

    return masks
        .mapConcat(stages.getSubstituentGenerator()::expand)
        .map(candidate -> count(candidatePatterns, candidate))
        .<HierarchyEntry>statefulMapConcat(() -> {
          HierarchyAssembler assembler = new HierarchyAssembler(stages.getRenderer());
          return candidate -> assembler.accept(candidate).map(List::of).orElse(List.of());
        })
        .withAttributes(ActorAttributes.withSupervisionStrategy(Supervision.getStoppingDecider()))
        .runWith(Sink.seq(), actorSystem)
        .thenApply(entries -> {
          HierarchyTable table = HierarchyTable.assemble(entries);
          long lineages = entries.stream().map(HierarchyEntry::lineage).distinct().count();
          GenerationStatistics statistics = GenerationStatistics.builder()
              .skeletons(skeletons.get())
              .cores(cores.get())
              .candidateMasks(candidateMasks.get())
              .uniqueMasks(uniqueMasks.get())
              .candidatePatterns(candidatePatterns.get())
              .rows(table.size())
              .ancestorCacheMisses(lineages)
              .ancestorCacheHits(table.size() - lineages)
              .build();
          log.info("Skeletons: {}, cores: {}, masks: {} of {} unique, final patterns: {} of {} unique",
              statistics.getSkeletons(), statistics.getCores(), statistics.getUniqueMasks(),
              statistics.getCandidateMasks(), statistics.getRows(), statistics.getCandidatePatterns());
          return new GenerationResult(table, statistics);
        });
  }

  private Source<Skeleton, NotUsed> createSkeletonSource() {
    return Source.fromIterator(() -> stages.getSkeletonGenerator().generate().iterator());
  }

  private static <T> T count(AtomicInteger counter, T item) {
    counter.incrementAndGet();
    return item;
  }

  private static <T> T count(AtomicLong counter, T item) {
    counter.incrementAndGet();
    return item;
  }
}
