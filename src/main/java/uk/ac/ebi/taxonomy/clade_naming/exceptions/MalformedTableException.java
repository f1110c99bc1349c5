package uk.ac.ebi.taxonomy.clade_naming.exceptions;

/** Thrown when an input table is missing a required column or holds an unparsable value. */
public class MalformedTableException extends NamingException {

  public MalformedTableException(String message) {
    super(message);
  }

  public MalformedTableException(String message, Throwable cause) {
    super(message, cause);
  }
}
