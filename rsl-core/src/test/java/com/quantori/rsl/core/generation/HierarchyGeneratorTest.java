package com.quantori.rsl.core.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.rsl.api.model.HierarchyRow;
import com.quantori.rsl.api.model.Layer;
import com.quantori.rsl.api.model.Position;
import com.quantori.rsl.api.model.Tag;
import com.quantori.rsl.api.render.SmartsRenderer;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import com.quantori.rsl.core.model.GenerationResult;
import com.quantori.rsl.core.model.GenerationStatistics;
import com.quantori.rsl.core.model.HierarchyEntry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class HierarchyGeneratorTest {
  private static Vocabulary vocabulary;
  private static GenerationResult result;

  @BeforeAll
  static void setUp() {
    vocabulary = Vocabulary.defaults();
    result = new HierarchyGenerator(vocabulary).generate();
  }

  @Test
  void stageCountsMatchExpectedEnumeration() {
    GenerationStatistics statistics = result.getStatistics();

    assertThat(statistics.getSkeletons()).isEqualTo(7);
    assertThat(statistics.getCores()).isEqualTo(28);
    assertThat(statistics.getCandidateMasks()).isEqualTo(156);
    assertThat(statistics.getUniqueMasks()).isEqualTo(98);
    assertThat(statistics.getCandidatePatterns()).isEqualTo(38_600);
    assertThat(statistics.getRows()).isEqualTo(34_190);
    assertThat(result.getTable().size()).isEqualTo(34_190);
  }

  @Test
  void ancestorsAreRenderedOncePerUniqueMask() {
    GenerationStatistics statistics = result.getStatistics();

    assertThat(statistics.getAncestorCacheMisses()).isEqualTo(98);
    assertThat(statistics.getAncestorCacheHits()).isEqualTo(34_190 - 98);
  }

  @Test
  void everyRowHasDistinctOrbit() {
    List<HierarchyEntry> entries = result.getTable().getEntries();
    Set<List<Position>> keys = new HashSet<>();
    for (HierarchyEntry entry : entries) {
      assertThat(keys.add(SubstituentGenerator.canonicalKey(entry.pattern()))).isTrue();
      assertThat(entry.canonicalKey()).isEqualTo(SubstituentGenerator.canonicalKey(entry.pattern()));
    }
    assertThat(entries.stream().map(entry -> entry.row().layer5()).collect(Collectors.toSet()))
        .hasSize(entries.size());
  }

  @Test
  void cachedAncestorsMatchIndependentRendering() {
    SmartsRenderer renderer = new SmartsRenderer(vocabulary);
    List<HierarchyEntry> entries = result.getTable().getEntries();
    for (int i = 0; i < entries.size(); i += 97) {
      HierarchyEntry entry = entries.get(i);
      HierarchyRow row = entry.row();

      assertThat(row.layer1()).isEqualTo(renderer.render(entry.lineage().core(), Layer.GENERIC_RING));
      assertThat(row.layer2()).isEqualTo(renderer.renderSkeleton(entry.lineage().skeleton()));
      assertThat(row.layer3()).isEqualTo(renderer.render(entry.lineage().core(), Layer.CORE));
      assertThat(row.layer4()).isEqualTo(renderer.render(entry.lineage().mask(), Layer.MASK));
      assertThat(row.layer5()).isEqualTo(renderer.render(entry.pattern(), Layer.SUBSTITUTED));
    }
  }

  @Test
  void finalPatternDescendsFromItsMask() {
    for (HierarchyEntry entry : result.getTable().getEntries()) {
      List<Position> mask = entry.lineage().mask().positions();
      List<Position> pattern = entry.pattern().positions();
      for (int i = 0; i < mask.size(); i++) {
        assertThat(pattern.get(i).token()).isEqualTo(mask.get(i).token());
        if (mask.get(i).tag().is(Tag.Kind.OPEN)) {
          assertThat(pattern.get(i).tag().kind()).isEqualTo(Tag.Kind.SUBSTITUENT);
        } else {
          assertThat(pattern.get(i).tag()).isEqualTo(mask.get(i).tag());
        }
      }
    }
  }

  @Test
  void rowsAreSortedAcrossAllColumns() {
    List<HierarchyRow> rows = result.getTable().getRows();
    List<HierarchyRow> sorted = new ArrayList<>(rows);
    sorted.sort(null);

    assertThat(rows).isEqualTo(sorted);
    assertThat(rows.get(0)).isEqualTo(new HierarchyRow(
        "[a:1]1:a:a:a:a:1",
        "[a:1]1:[#6](*):[#6](*):[#6](*):[#6](*):1",
        "[#16:1]1:[#6](*):[#6](*):[#6](*):[#6](*):1",
        "[#16:1]1:[#6](*):[#6](*):[#6](*):[#6]([#1]):1",
        "[#16:1]1:[#6]([CH,CH0]):[#6]([CH,CH0]):[#6]([CH,CH0]):[#6]([#1]):1"));
    assertThat(rows.get(rows.size() - 1)).isEqualTo(new HierarchyRow(
        "[a:1]1:a:a:a:a:1",
        "[a:1]1:[#7+0]:[#6](*):[#6](*):[#7+0]:1",
        "[#8:1]1:[#7+0]:[#6](*):[#6](*):[#7+0]:1",
        "[#8:1]1:[#7+0]:[#6](*):[#6](*):[#7+0]:1",
        "[#8:1]1:[#7+0]:[#6]([n+0]):[#6]([n+0]):[#7+0]:1"));
  }

  @Test
  void independentRunsAreIdentical() {
    GenerationResult second = new HierarchyGenerator(vocabulary).generate();

    assertThat(second.getTable().getRows()).isEqualTo(result.getTable().getRows());
    assertThat(second.getStatistics()).isEqualTo(result.getStatistics());
  }
}
