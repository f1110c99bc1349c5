package uk.ac.ebi.taxonomy.clade_naming.model;

import java.util.List;

/**
 * Domains whose trees can be named. Each carries the domain token that opens every rendered
 * taxonomy and the GTDB median RED values of its ranks from phylum to genus.
 */
public enum Domain {
  BACTERIA(
      "d__Bacteria",
      List.of(
          0.3280941769231098,
          0.449727838796469,
          0.6083500718998613,
          0.7576141066814935,
          0.9220350796053899)),

  ARCHAEA(
      "d__Archaea",
      List.of(
          0.2128708845277663,
          0.35878546884559126,
          0.5316295929627715,
          0.7250725361353227,
          0.9069458981600348));

  private final String token;
  private final List<Double> defaultCutoffs;

  Domain(String token, List<Double> defaultCutoffs) {
    this.token = token;
    this.defaultCutoffs = defaultCutoffs;
  }

  /** Returns the domain token, e.g. {@code "d__Bacteria"}. */
  public String getToken() {
    return token;
  }

  public List<Double> getDefaultCutoffs() {
    return defaultCutoffs;
  }

  /**
   * Resolves a domain from its token ({@code d__Bacteria}) or bare name ({@code archaea}).
   * Returns null if no matching domain is found.
   */
  public static Domain fromName(String name) {
    for (Domain domain : values()) {
      if (domain.token.equalsIgnoreCase(name) || domain.name().equalsIgnoreCase(name)) {
        return domain;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return token;
  }
}
