package uk.ac.ebi.taxonomy.clade_naming.exceptions;

import lombok.Getter;

/** Thrown when a novelty label does not name one of the six taxonomic ranks. */
@Getter
public class UnrecognizedNoveltyLabelException extends NamingException {

  private final String label;

  public UnrecognizedNoveltyLabelException(String label) {
    super("Unrecognized novelty label: '" + label + "'");
    this.label = label;
  }
}
