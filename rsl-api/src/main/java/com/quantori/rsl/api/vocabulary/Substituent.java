package com.quantori.rsl.api.vocabulary;

import org.apache.commons.lang3.StringUtils;

/**
 * Catalog entry: a short substituent code and the SMARTS sub-pattern it is rendered to.
 *
 * @param code   catalog code, i.e. {@code C1} or {@code Cl}
 * @param smarts rendered sub-pattern, i.e. {@code [CH3,CH2]}
 */
public record Substituent(String code, String smarts) {

  public Substituent {
    if (StringUtils.isBlank(code) || StringUtils.isBlank(smarts)) {
      throw new IllegalArgumentException("Substituent code and smarts must not be blank");
    }
  }
}
