package com.quantori.rsl.api.render;

import com.quantori.rsl.api.model.Core;
import com.quantori.rsl.api.model.Layer;
import com.quantori.rsl.api.model.Position;
import com.quantori.rsl.api.model.RingPattern;
import com.quantori.rsl.api.model.Skeleton;
import com.quantori.rsl.api.vocabulary.AtomToken;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders ring patterns to SMARTS strings of a given layer.
 * <p>
 * The result is the anchor atom followed by the ring-open bond, the remaining atoms joined by aromatic bonds and the
 * ring-close bond, i.e. {@code [#6:1](*)1:[#6](*):[#7+0]:[#6](*):[#7+0]:1}.
 */
public class SmartsRenderer {
  private static final String RING_OPEN = "1:";
  private static final String RING_CLOSE = ":1";
  private static final String BOND = ":";

  private final Vocabulary vocabulary;

  public SmartsRenderer(Vocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  /**
   * Renders a pattern at the given layer. The generic ring layer ignores the pattern entirely. At the skeleton layer
   * slot 0 is replaced by the generic aromatic anchor, at deeper layers slot 0 keeps its atom and receives the ring
   * closure label.
   *
   * @param pattern pattern to render
   * @param layer   target layer
   * @return SMARTS string, or an empty string for an empty pattern
   * @throws com.quantori.rsl.api.VocabularyException if a position references an unknown substituent code
   */
  public String render(RingPattern pattern, Layer layer) {
    return render(pattern.positions(), layer);
  }

  public String render(List<Position> positions, Layer layer) {
    if (positions.isEmpty()) {
      return StringUtils.EMPTY;
    }
    if (layer == Layer.GENERIC_RING) {
      return vocabulary.getGenericRing();
    }
    List<String> atoms = new ArrayList<>(positions.size());
    atoms.add(renderAnchor(positions.get(0), layer));
    for (Position position : positions.subList(1, positions.size())) {
      atoms.add(renderAtom(position));
    }
    return atoms.get(0) + RING_OPEN + String.join(BOND, atoms.subList(1, atoms.size())) + RING_CLOSE;
  }

  /**
   * Renders a skeleton at the skeleton layer: the skeleton closed into a ring through the generic aromatic anchor.
   */
  public String renderSkeleton(Skeleton skeleton) {
    return render(new Core(vocabulary.getGenericAnchor(), skeleton), Layer.SKELETON);
  }

  private String renderAnchor(Position position, Layer layer) {
    if (layer == Layer.SKELETON) {
      return addRingLabel(vocabulary.getGenericAnchor().text());
    }
    return addRingLabel(renderAtom(position));
  }

  private String renderAtom(Position position) {
    AtomToken token = position.token();
    return switch (position.tag().kind()) {
      case HYDROGEN_CAP -> substituteMarker(token, vocabulary.getHydrogenCap());
      case SUBSTITUENT -> substituteMarker(token, vocabulary.substituent(position.tag().code()).smarts());
      case UNSET, OPEN -> token.text();
    };
  }

  private String substituteMarker(AtomToken token, String branch) {
    return token.withoutMarker(vocabulary.getOpenValenceMarker()) + "(" + branch + ")";
  }

  private String addRingLabel(String atom) {
    String label = vocabulary.getRingLabel();
    if (atom.contains(label)) {
      return atom;
    }
    if (atom.contains("]")) {
      return StringUtils.replaceOnce(atom, "]", label + "]");
    }
    return "[" + atom + label + "]";
  }
}
