package uk.ac.ebi.taxonomy.clade_naming.model;

import uk.ac.ebi.taxonomy.clade_naming.exceptions.NamingException;

/** Helpers for building clade names. */
public final class CladeNames {

  private CladeNames() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Derives a species name from the genus found in {@code lineage}, e.g. {@code g__Foo} and
   * {@code MAG1} give {@code s__Foo MAG1}. The lineage may be a bare genus name or a full
   * semicolon-joined taxonomy ending at the genus.
   *
   * @throws NamingException if the lineage names no genus
   */
  public static String speciesFromGenus(String lineage, String genomeId) {
    int genus = lineage.indexOf(Rank.GENUS.prefix());
    if (genus < 0) {
      throw new NamingException("Cannot derive a species name from lineage without genus: " + lineage);
    }
    return Rank.SPECIES.getLetter() + lineage.substring(genus + 1) + " " + genomeId;
  }
}
