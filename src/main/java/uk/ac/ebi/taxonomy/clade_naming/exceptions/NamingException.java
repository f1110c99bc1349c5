package uk.ac.ebi.taxonomy.clade_naming.exceptions;

/**
 * Base type for failures caused by the naming inputs.
 *
 * <p>Subclasses name the broken input, such as a tree row pointing at an absent node or a genome
 * with no quality metadata. A node left for completion without any reference-classified
 * descendant is reported the same way. The command line maps this type to exit status 2.
 */
public class NamingException extends RuntimeException {

  public NamingException(String message) {
    super(message);
  }

  public NamingException(String message, Throwable cause) {
    super(message, cause);
  }
}
