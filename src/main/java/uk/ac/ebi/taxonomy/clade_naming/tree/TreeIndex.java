package uk.ac.ebi.taxonomy.clade_naming.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.api.set.primitive.MutableIntSet;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.IntObjectHashMap;
import org.eclipse.collections.impl.set.mutable.primitive.IntHashSet;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MissingNodeException;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.NamingException;
import uk.ac.ebi.taxonomy.clade_naming.model.TreeNode;

/**
 * Read-only lookup structures over the tree table: node by id, children by parent and the
 * ancestor path of a node.
 *
 * <p>The index is built once per run and never mutated afterwards, except for the lazily filled
 * ancestor cache.
 */
@Slf4j
public final class TreeIndex {

  private static final ImmutableIntList NO_CHILDREN = new IntArrayList().toImmutable();

  private final List<TreeNode> rows;
  private final MutableIntObjectMap<TreeNode> nodes;
  private final MutableIntObjectMap<MutableIntList> children;
  private final MutableIntObjectMap<ImmutableIntList> ancestorCache = new IntObjectHashMap<>();

  private TreeIndex(
      List<TreeNode> rows,
      MutableIntObjectMap<TreeNode> nodes,
      MutableIntObjectMap<MutableIntList> children) {
    this.rows = rows;
    this.nodes = nodes;
    this.children = children;
  }

  /**
   * Builds the index from tree rows.
   *
   * @param treeRows rows of the tree table, in file order
   * @return the index
   * @throws MissingNodeException if a row names a parent that has no row of its own
   */
  public static TreeIndex build(Collection<TreeNode> treeRows) {
    MutableIntObjectMap<TreeNode> nodes = new IntObjectHashMap<>(treeRows.size());
    for (TreeNode row : treeRows) {
      if (nodes.put(row.nodeId(), row) != null) {
        log.warn("Duplicate row for node {}; keeping the last one", row.nodeId());
      }
    }

    List<TreeNode> rows = new ArrayList<>(nodes.size());
    MutableIntObjectMap<MutableIntList> children = new IntObjectHashMap<>();
    for (TreeNode row : treeRows) {
      if (nodes.get(row.nodeId()) != row) {
        continue;
      }
      rows.add(row);
      if (row.isRoot()) {
        continue;
      }
      if (!nodes.containsKey(row.parentId())) {
        throw new MissingNodeException(row.parentId(), row.nodeId());
      }
      children.getIfAbsentPut(row.parentId(), IntArrayList::new).add(row.nodeId());
    }

    log.debug("Indexed {} tree nodes, {} with children", rows.size(), children.size());
    return new TreeIndex(Collections.unmodifiableList(rows), nodes, children);
  }

  public int size() {
    return rows.size();
  }

  boolean contains(int nodeId) {
    return nodes.containsKey(nodeId);
  }

  /**
   * Returns the row of a node.
   *
   * @throws MissingNodeException if the node is not in the tree
   */
  public TreeNode node(int nodeId) {
    TreeNode node = nodes.get(nodeId);
    if (node == null) {
      throw new MissingNodeException(nodeId);
    }
    return node;
  }

  /** Leaves holding genomes that await naming, in file order. */
  public List<TreeNode> queryGenomes() {
    return rows.stream().filter(TreeNode::isQueryGenome).toList();
  }

  /** Direct children of a node, a root excluded from its own children. */
  public IntList children(int nodeId) {
    MutableIntList nodeChildren = children.get(nodeId);
    return nodeChildren == null ? NO_CHILDREN : nodeChildren.asUnmodifiable();
  }

  /**
   * Returns the ancestors of a node ordered from its parent up to the root. A root has no
   * ancestors.
   */
  public IntList ancestors(int nodeId) {
    return ancestorCache.getIfAbsentPut(nodeId, () -> walkToRoot(nodeId));
  }

  /** Every node below {@code nodeId}, excluding the node itself. */
  public MutableIntSet descendants(int nodeId) {
    MutableIntSet found = new IntHashSet();
    MutableIntList stack = new IntArrayList();
    stack.addAll(children(nodeId));
    while (stack.notEmpty()) {
      int current = stack.removeAtIndex(stack.size() - 1);
      if (found.add(current)) {
        stack.addAll(children(current));
      }
    }
    return found;
  }

  /**
   * RED of the node itself.
   *
   * @throws NamingException if the node carries no RED value
   */
  public double red(int nodeId) {
    Double red = node(nodeId).red();
    if (red == null) {
      throw new NamingException("Node " + nodeId + " has no RED value");
    }
    return red;
  }

  /**
   * RED at the top of the branch leading to a node, i.e. the RED of its parent. A root sits on a
   * branch starting at 0.
   */
  public double branchRed(int nodeId) {
    TreeNode node = node(nodeId);
    return node.isRoot() ? 0.0 : red(node.parentId());
  }

  private ImmutableIntList walkToRoot(int nodeId) {
    MutableIntList path = new IntArrayList();
    TreeNode current = node(nodeId);
    while (!current.isRoot()) {
      if (path.size() > rows.size()) {
        throw new NamingException("Cycle detected on the path from node " + nodeId + " to its root");
      }
      path.add(current.parentId());
      current = node(current.parentId());
    }
    return path.toImmutable();
  }
}
