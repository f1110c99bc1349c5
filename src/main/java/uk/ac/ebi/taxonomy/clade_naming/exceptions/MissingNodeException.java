package uk.ac.ebi.taxonomy.clade_naming.exceptions;

import lombok.Getter;

/** Thrown when a node id is referenced (as a parent or by lookup) but has no row in the tree. */
@Getter
public class MissingNodeException extends NamingException {

  private final int nodeId;

  public MissingNodeException(int nodeId) {
    super("Node " + nodeId + " is not present in the tree table");
    this.nodeId = nodeId;
  }

  public MissingNodeException(int nodeId, int referencedBy) {
    super("Node " + nodeId + " (parent of node " + referencedBy + ") is not present in the tree table");
    this.nodeId = nodeId;
  }
}
