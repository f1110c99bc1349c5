package uk.ac.ebi.taxonomy.clade_naming.model;

import uk.ac.ebi.taxonomy.clade_naming.Constants;

/**
 * Taxonomy string assigned to a query genome.
 *
 * @param genomeId the genome id
 * @param taxonomy domain-prefixed, semicolon-joined clade names, or a bare node id followed by
 *     the ranks named below it while the completion pass is still pending
 */
public record GenomeTaxonomy(String genomeId, String taxonomy) {

  /** True while the taxonomy still starts at a reference node instead of the domain. */
  public boolean awaitsCompletion() {
    return !taxonomy.startsWith(Constants.DOMAIN_PREFIX);
  }
}
