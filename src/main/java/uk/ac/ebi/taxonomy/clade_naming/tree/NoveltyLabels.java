package uk.ac.ebi.taxonomy.clade_naming.tree;

import uk.ac.ebi.taxonomy.clade_naming.exceptions.UnrecognizedNoveltyLabelException;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;

/**
 * Parses novelty labels such as {@code "Species/Strain (0.95-1]"} or {@code "Genus (0.82-0.95]"}
 * into the rank they open. Only the first word, up to any {@code /}, is significant.
 */
public final class NoveltyLabels {

  private NoveltyLabels() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Returns the rank named by a label, or null for a null or blank label.
   *
   * @throws UnrecognizedNoveltyLabelException if the label names no known rank
   */
  public static Rank parse(String label) {
    if (label == null || label.isBlank()) {
      return null;
    }
    String word = label.strip().split("\\s+")[0].split("/")[0];
    Rank rank = Rank.fromName(word);
    if (rank == null) {
      throw new UnrecognizedNoveltyLabelException(label);
    }
    return rank;
  }
}
