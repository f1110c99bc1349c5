package uk.ac.ebi.taxonomy.clade_naming.model;

import java.util.List;
import java.util.Locale;

/**
 * The six taxonomic ranks named below the domain, ordered from the root of the tree towards the
 * leaves. The declaration order is the rank order used throughout naming.
 */
public enum Rank {
  PHYLUM("phylum", 'p'),
  CLASS("class", 'c'),
  ORDER("order", 'o'),
  FAMILY("family", 'f'),
  GENUS("genus", 'g'),
  SPECIES("species", 's');

  private static final List<Rank> ORDERED = List.of(values());

  private final String name;
  private final char letter;

  Rank(String name, char letter) {
    this.name = name;
    this.letter = letter;
  }

  /** Returns the lower-case rank name used in novelty labels. */
  public String getName() {
    return name;
  }

  public char getLetter() {
    return letter;
  }

  /** Returns the clade-name prefix for this rank, e.g. {@code "g__"}. */
  public String prefix() {
    return letter + "__";
  }

  /** Returns the clade name this rank takes when minted after a genome, e.g. {@code "f__MAG1"}. */
  public String cladeNameFor(String genomeId) {
    return prefix() + genomeId;
  }

  public boolean isAbove(Rank other) {
    return ordinal() < other.ordinal();
  }

  public boolean isBelow(Rank other) {
    return ordinal() > other.ordinal();
  }

  /** Returns the rank at the given position (0 = phylum). */
  public static Rank atLevel(int level) {
    return ORDERED.get(level);
  }

  /** Ranks from {@code upper} (inclusive) to {@code lower} (exclusive). Empty when not ordered. */
  public static List<Rank> between(Rank upper, Rank lower) {
    if (upper.ordinal() >= lower.ordinal()) {
      return List.of();
    }
    return ORDERED.subList(upper.ordinal(), lower.ordinal());
  }

  public static List<Rank> ordered() {
    return ORDERED;
  }

  /**
   * Parses a rank name case-insensitively. Returns null if no matching rank is found.
   */
  public static Rank fromName(String name) {
    if (name == null) {
      return null;
    }
    String lowered = name.toLowerCase(Locale.ROOT);
    for (Rank rank : values()) {
      if (rank.name.equals(lowered)) {
        return rank;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return name;
  }
}
