package uk.ac.ebi.taxonomy.clade_naming.tree;

import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.map.mutable.primitive.IntObjectHashMap;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;
import uk.ac.ebi.taxonomy.clade_naming.model.TreeNode;

/**
 * Derives the {@link NoveltyBounds} of a node from its own novelty label and, for query
 * branches, the label of its parent. Results are memoized per node.
 */
public class NoveltyIntervalResolver {

  private final TreeIndex tree;
  private final MutableIntObjectMap<NoveltyBounds> resolved = new IntObjectHashMap<>();

  public NoveltyIntervalResolver(TreeIndex tree) {
    this.tree = tree;
  }

  public NoveltyBounds boundsOf(int nodeId) {
    return resolved.getIfAbsentPut(nodeId, () -> resolve(nodeId));
  }

  private NoveltyBounds resolve(int nodeId) {
    TreeNode node = tree.node(nodeId);
    Rank self = node.noveltyRank();
    if (self == null) {
      return NoveltyBounds.UNLABELLED;
    }
    if (node.isReferenceBranch()) {
      return new NoveltyBounds(null, self);
    }
    // a root is its own parent
    Rank upper = tree.node(node.parentId()).noveltyRank();
    return upper == null ? NoveltyBounds.UNLABELLED : new NoveltyBounds(upper, self);
  }
}
