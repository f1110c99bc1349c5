package uk.ac.ebi.taxonomy.clade_naming.model;

/**
 * Completeness and contamination estimates of a genome, both percentages.
 */
public record GenomeQuality(String genomeId, double completeness, double contamination) {

  public static final double CONTAMINATION_WEIGHT = 5.0;

  /** Quality score used to order naming priority: completeness − 5 × contamination. */
  public double quality() {
    return completeness - CONTAMINATION_WEIGHT * contamination;
  }
}
