package com.quantori.rsl.api.vocabulary;

import com.quantori.rsl.api.VocabularyException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable set of tokens and the substituent catalog used by every generation stage.
 * <p>
 * The vocabulary is constructed once, usually from the {@code ring-smarts.vocabulary} section of the configuration,
 * and passed explicitly into the renderer and the generators.
 */
@Getter
public final class Vocabulary {
  public static final String CONFIG_PATH = "ring-smarts.vocabulary";

  /**
   * Pattern of the fully generic aromatic five-membered ring.
   */
  private final String genericRing;
  /**
   * Generic aromatic atom used as the ring anchor when only the ring composition is fixed.
   */
  private final AtomToken genericAnchor;
  private final String hydrogenCap;
  private final String openValenceMarker;
  private final String ringLabel;
  /**
   * Carbon-like symbol of the skeleton alphabet, always bears the open-valence marker.
   */
  private final AtomToken carbonLike;
  /**
   * Nitrogen-like symbol of the skeleton alphabet, never bears the open-valence marker.
   */
  private final AtomToken nitrogenLike;
  private final int maxNitrogenLike;
  private final List<AtomToken> centers;
  private final List<Integer> openPositionCounts;
  private final List<Substituent> substituents;
  @Getter(AccessLevel.NONE)
  private final Map<String, Substituent> catalog;

  @Builder
  private Vocabulary(
      String genericRing,
      AtomToken genericAnchor,
      String hydrogenCap,
      String openValenceMarker,
      String ringLabel,
      AtomToken carbonLike,
      AtomToken nitrogenLike,
      int maxNitrogenLike,
      @Singular List<AtomToken> centers,
      @Singular List<Integer> openPositionCounts,
      @Singular List<Substituent> substituents) {
    this.genericRing = requireNotBlank(genericRing, "generic-ring");
    this.genericAnchor = requireNotNull(genericAnchor, "generic-anchor");
    this.hydrogenCap = requireNotBlank(hydrogenCap, "hydrogen-cap");
    this.openValenceMarker = requireNotBlank(openValenceMarker, "open-valence-marker");
    this.ringLabel = requireNotBlank(ringLabel, "ring-label");
    this.carbonLike = requireNotNull(carbonLike, "skeleton.carbon-like");
    this.nitrogenLike = requireNotNull(nitrogenLike, "skeleton.nitrogen-like");
    if (carbonLike.equals(nitrogenLike)) {
      throw new VocabularyException("Skeleton alphabet must consist of two distinct symbols: " + carbonLike);
    }
    if (!carbonLike.hasMarker(openValenceMarker) || nitrogenLike.hasMarker(openValenceMarker)) {
      throw new VocabularyException(
          "Only the carbon-like skeleton symbol may carry the open-valence marker " + openValenceMarker);
    }
    if (maxNitrogenLike < 0) {
      throw new VocabularyException("Maximum count of nitrogen-like symbols must not be negative: " + maxNitrogenLike);
    }
    this.maxNitrogenLike = maxNitrogenLike;
    if (centers.isEmpty()) {
      throw new VocabularyException("At least one center token is required");
    }
    this.centers = List.copyOf(centers);
    if (openPositionCounts.isEmpty() || openPositionCounts.stream().anyMatch(count -> count < 0)) {
      throw new VocabularyException("Open position counts must be a non-empty list of non-negative numbers");
    }
    this.openPositionCounts = List.copyOf(openPositionCounts);
    if (substituents.isEmpty()) {
      throw new VocabularyException("Substituent catalog must not be empty");
    }
    this.substituents = List.copyOf(substituents);
    Map<String, Substituent> byCode = new LinkedHashMap<>();
    for (Substituent substituent : substituents) {
      if (byCode.putIfAbsent(substituent.code(), substituent) != null) {
        throw new VocabularyException("Duplicate substituent code in catalog: " + substituent.code());
      }
    }
    this.catalog = Collections.unmodifiableMap(byCode);
  }

  /**
   * Loads the vocabulary from the default configuration ({@code reference.conf} and any overrides).
   *
   * @return the vocabulary
   */
  public static Vocabulary defaults() {
    return fromConfig(ConfigFactory.load());
  }

  /**
   * Reads the vocabulary from the {@value #CONFIG_PATH} section of the given configuration.
   *
   * @param config application configuration
   * @return the vocabulary
   * @throws VocabularyException if a key is missing or has a wrong type, or the values are inconsistent
   */
  public static Vocabulary fromConfig(Config config) {
    try {
      Config section = config.getConfig(CONFIG_PATH);
      var builder = Vocabulary.builder()
          .genericRing(section.getString("generic-ring"))
          .genericAnchor(AtomToken.of(section.getString("generic-anchor")))
          .hydrogenCap(section.getString("hydrogen-cap"))
          .openValenceMarker(section.getString("open-valence-marker"))
          .ringLabel(section.getString("ring-label"))
          .carbonLike(AtomToken.of(section.getString("skeleton.carbon-like")))
          .nitrogenLike(AtomToken.of(section.getString("skeleton.nitrogen-like")))
          .maxNitrogenLike(section.getInt("skeleton.max-nitrogen-like"))
          .openPositionCounts(section.getIntList("open-position-counts"));
      section.getStringList("centers").forEach(center -> builder.center(AtomToken.of(center)));
      section.getConfigList("substituents").forEach(entry ->
          builder.substituent(new Substituent(entry.getString("code"), entry.getString("smarts"))));
      return builder.build();
    } catch (ConfigException | IllegalArgumentException e) {
      throw new VocabularyException("Unable to read vocabulary from configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Symbols the skeleton positions are drawn from, carbon-like first.
   */
  public List<AtomToken> getSkeletonAlphabet() {
    return List.of(carbonLike, nitrogenLike);
  }

  public Optional<Substituent> findSubstituent(String code) {
    return Optional.ofNullable(catalog.get(code));
  }

  /**
   * Looks up a catalog entry.
   *
   * @param code substituent code
   * @return the catalog entry
   * @throws VocabularyException if the code is not a part of the catalog
   */
  public Substituent substituent(String code) {
    return findSubstituent(code)
        .orElseThrow(() -> new VocabularyException("Unknown substituent code: " + code));
  }

  public boolean hasOpenValence(AtomToken token) {
    return token.hasMarker(openValenceMarker);
  }

  private static String requireNotBlank(String value, String key) {
    if (StringUtils.isBlank(value)) {
      throw new VocabularyException("Vocabulary value is missing: " + key);
    }
    return value;
  }

  private static <T> T requireNotNull(T value, String key) {
    if (value == null) {
      throw new VocabularyException("Vocabulary value is missing: " + key);
    }
    return value;
  }
}
