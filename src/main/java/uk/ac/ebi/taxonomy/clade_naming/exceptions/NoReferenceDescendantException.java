package uk.ac.ebi.taxonomy.clade_naming.exceptions;

import lombok.Getter;

/**
 * Thrown by the completion pass when a node that terminated naming has no descendant genome with
 * a usable reference taxonomy.
 */
@Getter
public class NoReferenceDescendantException extends NamingException {

  private final int nodeId;

  public NoReferenceDescendantException(int nodeId, String rankLimit) {
    super(
        "Node "
            + nodeId
            + " has no reference-classified descendant with a lineage above '"
            + rankLimit
            + "'");
    this.nodeId = nodeId;
  }
}
