package uk.ac.ebi.taxonomy.clade_naming.exceptions;

import lombok.Getter;

/** Thrown when a query genome has no completeness/contamination row in the metadata table. */
@Getter
public class MissingMetadataException extends NamingException {

  private final String genomeId;

  public MissingMetadataException(String genomeId) {
    super("No quality metadata found for genome '" + genomeId + "'");
    this.genomeId = genomeId;
  }
}
