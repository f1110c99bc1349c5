package uk.ac.ebi.taxonomy.clade_naming.model;

import lombok.Builder;
import uk.ac.ebi.taxonomy.clade_naming.Constants;

/**
 * One row of the tree table.
 *
 * @param nodeId unique node id
 * @param parentId parent node id; equal to {@code nodeId} for a root
 * @param referenceGroup {@code "gtdb"} on reference branches, another tag on query branches
 * @param genomeId genome placed at this leaf, null for internal nodes
 * @param magset genome set the leaf comes from; {@code "GTDB"} or null for reference genomes
 * @param red relative evolutionary divergence of the node
 * @param noveltyRank rank encoded by the node's novelty label, null when unlabelled
 */
@Builder
public record TreeNode(
    int nodeId,
    int parentId,
    String referenceGroup,
    String genomeId,
    String magset,
    Double red,
    Rank noveltyRank) {

  public boolean isRoot() {
    return nodeId == parentId;
  }

  public boolean isLeaf() {
    return genomeId != null;
  }

  /** True unless the node carries a non-reference group tag. */
  public boolean isReferenceBranch() {
    return referenceGroup == null || Constants.REFERENCE_GROUP.equals(referenceGroup);
  }

  /** True for leaves holding a genome that awaits naming. */
  public boolean isQueryGenome() {
    return genomeId != null && magset != null && !Constants.REFERENCE_MAGSET.equals(magset);
  }
}
