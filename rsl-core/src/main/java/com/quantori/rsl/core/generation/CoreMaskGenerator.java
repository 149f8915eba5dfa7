package com.quantori.rsl.core.generation;

import com.quantori.rsl.api.model.Core;
import com.quantori.rsl.api.model.Lineage;
import com.quantori.rsl.api.model.Mask;
import com.quantori.rsl.api.model.Position;
import com.quantori.rsl.api.model.Skeleton;
import com.quantori.rsl.api.model.Tag;
import com.quantori.rsl.api.symmetry.SymmetryCanonicalizer;
import com.quantori.rsl.api.vocabulary.AtomToken;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Layers 3 and 4: closes skeletons into cores with every center atom and decides which marker-bearing positions stay
 * open for substitution and which are capped by hydrogen.
 */
public class CoreMaskGenerator {
  private final Vocabulary vocabulary;

  public CoreMaskGenerator(Vocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  public List<Core> coresOf(Skeleton skeleton) {
    return vocabulary.getCenters().stream()
        .map(center -> new Core(center, skeleton))
        .toList();
  }

  /**
   * Enumerates the masks of a core for every configured open position count, subsets in lexicographic order.
   * Counts exceeding the number of marker-bearing positions are skipped.
   *
   * @param core core to mask
   * @return masks together with their ancestry, in generation order
   */
  public List<Lineage> masksOf(Core core) {
    List<Integer> markerBearing = markerBearingPositions(core);
    List<Lineage> masks = new ArrayList<>();
    for (int count : vocabulary.getOpenPositionCounts()) {
      for (List<Integer> open : Combinatorics.combinations(markerBearing, count)) {
        masks.add(new Lineage(core.skeleton(), core, mask(core, open)));
      }
    }
    return masks;
  }

  public List<Integer> markerBearingPositions(Core core) {
    List<AtomToken> atoms = core.atoms();
    return IntStream.range(0, atoms.size())
        .filter(i -> vocabulary.hasOpenValence(atoms.get(i)))
        .boxed()
        .toList();
  }

  /**
   * Tags the given positions open, the remaining marker-bearing positions hydrogen-capped and leaves the others unset.
   */
  public Mask mask(Core core, Collection<Integer> open) {
    List<AtomToken> atoms = core.atoms();
    List<Position> positions = new ArrayList<>(atoms.size());
    for (int i = 0; i < atoms.size(); i++) {
      AtomToken atom = atoms.get(i);
      Tag tag;
      if (open.contains(i)) {
        tag = Tag.OPEN;
      } else if (vocabulary.hasOpenValence(atom)) {
        tag = Tag.HYDROGEN_CAP;
      } else {
        tag = Tag.UNSET;
      }
      positions.add(new Position(atom, tag));
    }
    return new Mask(positions);
  }

  public static List<Position> canonicalKey(Mask mask) {
    return SymmetryCanonicalizer.necklaceCanonical(mask.positions());
  }
}
