package uk.ac.ebi.taxonomy.clade_naming.model;

import java.util.Comparator;

/**
 * A clade created during naming.
 *
 * @param nodeId anchoring node, null when the clade is not tied to a node
 * @param cladeName unique clade name, e.g. {@code "g__MAG1"}
 * @param genomeRep representative genome the name was derived from
 */
public record NodeNaming(Integer nodeId, String cladeName, String genomeRep) {

  public static final Comparator<NodeNaming> BY_CLADE =
      Comparator.comparing(NodeNaming::cladeName);

  public static NodeNaming unanchored(String cladeName, String genomeRep) {
    return new NodeNaming(null, cladeName, genomeRep);
  }
}
