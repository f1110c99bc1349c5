package uk.ac.ebi.taxonomy.clade_naming.naming;

/**
 * What a genome holds at one rank.
 *
 * <p>Either a clade name, optionally anchored to a node, or a reference boundary: the node at
 * which the genome's lineage joins the reference tree, to be completed from reference taxonomy.
 *
 * @param nodeId anchoring node of a clade, or the reference node of a boundary
 * @param cladeName clade name, null for a reference boundary
 * @param referenceBoundary whether this is a reference boundary
 */
public record CladeAssignment(Integer nodeId, String cladeName, boolean referenceBoundary) {

  public static CladeAssignment clade(Integer nodeId, String cladeName) {
    return new CladeAssignment(nodeId, cladeName, false);
  }

  public static CladeAssignment unanchored(String cladeName) {
    return new CladeAssignment(null, cladeName, false);
  }

  public static CladeAssignment referenceBoundary(int nodeId) {
    return new CladeAssignment(nodeId, null, true);
  }
}
