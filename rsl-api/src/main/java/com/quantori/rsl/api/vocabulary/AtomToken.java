package com.quantori.rsl.api.vocabulary;

import org.apache.commons.lang3.StringUtils;

/**
 * Atom descriptor as it is written in a SMARTS pattern, i.e. {@code [#6](*)} or {@code [#7+0]}. A token may carry
 * the open-valence marker meaning the ring position may bear a substituent.
 *
 * @param text SMARTS text of the atom
 */
public record AtomToken(String text) implements Comparable<AtomToken> {

  public AtomToken {
    if (StringUtils.isBlank(text)) {
      throw new IllegalArgumentException("Atom token text must not be blank");
    }
  }

  public static AtomToken of(String text) {
    return new AtomToken(text);
  }

  /**
   * Checks whether the token carries the given open-valence marker.
   *
   * @param marker open-valence marker, i.e. {@code (*)}
   * @return true if the marker is a part of the token text
   */
  public boolean hasMarker(String marker) {
    return text.contains(marker);
  }

  /**
   * Returns the token text with the first occurrence of the open-valence marker removed.
   *
   * @param marker open-valence marker
   * @return the bare atom text
   */
  public String withoutMarker(String marker) {
    return StringUtils.replaceOnce(text, marker, StringUtils.EMPTY);
  }

  @Override
  public int compareTo(AtomToken other) {
    return text.compareTo(other.text);
  }

  @Override
  public String toString() {
    return text;
  }
}
