package uk.ac.ebi.taxonomy.clade_naming.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Median RED value per rank. The five configurable ranks come from the domain defaults or an
 * explicit override; species is fixed at 1.0.
 */
public final class RedCutoffs {

  public static final double SPECIES_MEDIAN = 1.0;

  private static final int CONFIGURABLE_RANKS = Rank.values().length - 1;

  private final Map<Rank, Double> medians;

  private RedCutoffs(List<Double> values) {
    if (values == null || values.size() != CONFIGURABLE_RANKS) {
      throw new IllegalArgumentException(
          "Expected "
              + CONFIGURABLE_RANKS
              + " RED cutoffs (phylum to genus) but got "
              + (values == null ? 0 : values.size()));
    }
    Map<Rank, Double> map = new EnumMap<>(Rank.class);
    for (int i = 0; i < values.size(); i++) {
      Double value = values.get(i);
      if (value == null || value < 0.0 || value > 1.0) {
        throw new IllegalArgumentException(
            "RED cutoff for " + Rank.atLevel(i) + " must be within [0, 1] but was " + value);
      }
      map.put(Rank.atLevel(i), value);
    }
    map.put(Rank.SPECIES, SPECIES_MEDIAN);
    this.medians = Collections.unmodifiableMap(map);
  }

  public static RedCutoffs forDomain(Domain domain) {
    return new RedCutoffs(domain.getDefaultCutoffs());
  }

  /**
   * Builds a table from explicit values for phylum, class, order, family and genus.
   *
   * @throws IllegalArgumentException if there are not exactly five values in [0, 1]
   */
  public static RedCutoffs of(List<Double> phylumToGenus) {
    return new RedCutoffs(phylumToGenus);
  }

  public double median(Rank rank) {
    return medians.get(rank);
  }

  /**
   * Returns true when {@code candidate} lies strictly closer to the median of {@code rank} than
   * {@code incumbent}. Equal distances favour the incumbent.
   */
  public boolean isCloser(double candidate, double incumbent, Rank rank) {
    double median = median(rank);
    return Math.abs(candidate - median) < Math.abs(incumbent - median);
  }

  @Override
  public String toString() {
    return medians.toString();
  }
}
