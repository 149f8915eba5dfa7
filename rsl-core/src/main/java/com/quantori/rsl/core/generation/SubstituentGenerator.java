package com.quantori.rsl.core.generation;

import com.quantori.rsl.api.model.FinalPattern;
import com.quantori.rsl.api.model.Lineage;
import com.quantori.rsl.api.model.Mask;
import com.quantori.rsl.api.model.Position;
import com.quantori.rsl.api.model.Tag;
import com.quantori.rsl.api.symmetry.SymmetryCanonicalizer;
import com.quantori.rsl.api.vocabulary.Substituent;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 5: assigns catalog substituents, with repetition, to the open positions of a mask.
 */
public class SubstituentGenerator {
  private final Vocabulary vocabulary;

  public SubstituentGenerator(Vocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  /**
   * Enumerates every assignment of catalog substituents to the open positions of the lineage mask. Assignments
   * follow the catalog order, the last open position varying fastest.
   *
   * @param lineage lineage whose mask is substituted
   * @return {@code C^m} candidates, {@code C} being the catalog size and {@code m} the number of open positions
   */
  public List<FinalCandidate> expand(Lineage lineage) {
    Mask mask = lineage.mask();
    List<Integer> open = mask.openPositions();
    List<List<Substituent>> assignments = Combinatorics.product(vocabulary.getSubstituents(), open.size());
    List<FinalCandidate> candidates = new ArrayList<>(assignments.size());
    for (List<Substituent> assignment : assignments) {
      candidates.add(new FinalCandidate(lineage, substitute(mask, open, assignment)));
    }
    return candidates;
  }

  public static List<Position> canonicalKey(FinalPattern pattern) {
    return SymmetryCanonicalizer.necklaceCanonical(pattern.positions());
  }

  private static FinalPattern substitute(Mask mask, List<Integer> open, List<Substituent> assignment) {
    List<Position> positions = new ArrayList<>(mask.positions());
    for (int i = 0; i < open.size(); i++) {
      int slot = open.get(i);
      positions.set(slot, positions.get(slot).withTag(Tag.substituent(assignment.get(i).code())));
    }
    return new FinalPattern(positions);
  }
}
