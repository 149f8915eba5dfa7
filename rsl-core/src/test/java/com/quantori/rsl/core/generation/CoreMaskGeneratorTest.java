package com.quantori.rsl.core.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.rsl.api.model.Core;
import com.quantori.rsl.api.model.Lineage;
import com.quantori.rsl.api.model.Mask;
import com.quantori.rsl.api.model.Position;
import com.quantori.rsl.api.model.Skeleton;
import com.quantori.rsl.api.model.Tag;
import com.quantori.rsl.api.vocabulary.AtomToken;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class CoreMaskGeneratorTest {
  private static final AtomToken C = AtomToken.of("[#6](*)");
  private static final AtomToken N = AtomToken.of("[#7+0]");
  private static final AtomToken N_MARKED = AtomToken.of("[#7+0](*)");
  private static final AtomToken O = AtomToken.of("[#8]");
  private static final AtomToken S = AtomToken.of("[#16]");

  private static CoreMaskGenerator generator;

  @BeforeAll
  static void setUp() {
    generator = new CoreMaskGenerator(Vocabulary.defaults());
  }

  @Test
  void everyCenterClosesTheSkeleton() {
    Skeleton skeleton = Skeleton.of(C, N, C, N);

    assertThat(generator.coresOf(skeleton)).containsExactly(
        new Core(C, skeleton), new Core(N_MARKED, skeleton), new Core(O, skeleton), new Core(S, skeleton));
  }

  @Test
  void markerBearingPositionsIncludeMarkedCenter() {
    Skeleton skeleton = Skeleton.of(C, N, C, N);

    assertThat(generator.markerBearingPositions(new Core(N_MARKED, skeleton))).containsExactly(0, 1, 3);
    assertThat(generator.markerBearingPositions(new Core(O, skeleton))).containsExactly(1, 3);
  }

  @Test
  void masksCoverTwoAndThreeOpenPositions() {
    Core core = new Core(C, Skeleton.of(C, C, N, N));

    List<Lineage> masks = generator.masksOf(core);

    // three marker-bearing positions: three pairs and one triple
    assertThat(masks).hasSize(4);
    assertThat(masks).extracting(lineage -> lineage.mask().openPositions()).containsExactly(
        List.of(0, 1), List.of(0, 2), List.of(1, 2), List.of(0, 1, 2));
    assertThat(masks).allMatch(lineage -> lineage.core().equals(core) && lineage.skeleton().equals(core.skeleton()));
  }

  @Test
  void coreWithTooFewMarkersHasNoMasks() {
    Core core = new Core(O, Skeleton.of(C, N, N, N));

    assertThat(generator.masksOf(core)).isEmpty();
  }

  @Test
  void maskCapsRemainingMarkerBearingPositions() {
    Core core = new Core(C, Skeleton.of(C, N, C, N));

    Mask mask = generator.mask(core, Set.of(0, 3));

    assertThat(mask.positions()).containsExactly(
        new Position(C, Tag.OPEN),
        new Position(C, Tag.HYDROGEN_CAP),
        new Position(N, Tag.UNSET),
        new Position(C, Tag.OPEN),
        new Position(N, Tag.UNSET));
  }

  @Test
  void rotatedMasksShareCanonicalKey() {
    Mask mask = generator.mask(new Core(C, Skeleton.of(C, N, C, N)), Set.of(0, 1));
    Mask rotated = generator.mask(new Core(C, Skeleton.of(N, C, N, C)), Set.of(0, 4));

    assertThat(CoreMaskGenerator.canonicalKey(mask)).isEqualTo(CoreMaskGenerator.canonicalKey(rotated));
  }
}
