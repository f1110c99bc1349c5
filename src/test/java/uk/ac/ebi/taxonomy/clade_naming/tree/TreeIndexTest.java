package uk.ac.ebi.taxonomy.clade_naming.tree;

import static org.junit.jupiter.api.Assertions.*;
import static uk.ac.ebi.taxonomy.clade_naming.TreeFixture.GENUS;
import static uk.ac.ebi.taxonomy.clade_naming.TreeFixture.PHYLUM;
import static uk.ac.ebi.taxonomy.clade_naming.TreeFixture.SPECIES;

import java.util.List;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.set.mutable.primitive.IntHashSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.ac.ebi.taxonomy.clade_naming.TreeFixture;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MissingNodeException;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.NamingException;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;
import uk.ac.ebi.taxonomy.clade_naming.model.TreeNode;

@DisplayName("TreeIndex Tests")
class TreeIndexTest {

  private TreeIndex tree;

  @BeforeEach
  void setUp() {
    tree =
        TreeFixture.tree()
            .row(10, 1, "nongtdb", "mag_1", "SPIRE", null, null)
            .row(10, 2, "gtdb", "GB_GCA_1", null, null, null)
            .row(100, 3, "nongtdb", "mag_3", "binchicken", null, null)
            .row(100, 10, "nongtdb", null, null, 0.97, SPECIES)
            .row(0, 100, "nongtdb", null, null, 0.85, GENUS)
            .row(0, 0, "gtdb", null, null, 0.3, PHYLUM)
            .index();
  }

  @Nested
  @DisplayName("Structure")
  class Structure {

    @Test
    void testChildrenInFileOrder() {
      assertEquals(IntArrayList.newListWith(1, 2), tree.children(10));
      assertEquals(IntArrayList.newListWith(3, 10), tree.children(100));
    }

    @Test
    void testRootIsNotItsOwnChild() {
      assertEquals(IntArrayList.newListWith(100), tree.children(0));
    }

    @Test
    void testLeafHasNoChildren() {
      assertTrue(tree.children(1).isEmpty());
    }

    @Test
    void testAncestorsRunFromParentToRoot() {
      assertEquals(IntArrayList.newListWith(10, 100, 0), tree.ancestors(1));
      assertTrue(tree.ancestors(0).isEmpty());
    }

    @Test
    void testDescendantsExcludeTheNodeItself() {
      assertEquals(IntHashSet.newSetWith(3, 10, 1, 2), tree.descendants(100));
      assertTrue(tree.descendants(3).isEmpty());
    }

    @Test
    void testQueryGenomesSkipReferenceLeaves() {
      assertEquals(
          List.of("mag_1", "mag_3"),
          tree.queryGenomes().stream().map(TreeNode::genomeId).toList());
    }
  }

  @Nested
  @DisplayName("RED values")
  class RedValues {

    @Test
    void testBranchRedIsParentRed() {
      assertEquals(0.85, tree.branchRed(10));
      assertEquals(0.3, tree.branchRed(100));
    }

    @Test
    void testRootBranchStartsAtZero() {
      assertEquals(0.0, tree.branchRed(0));
    }

    @Test
    void testMissingRedFails() {
      assertThrows(NamingException.class, () -> tree.red(1));
    }
  }

  @Test
  void testNodeLabelIsParsed() {
    assertEquals(Rank.GENUS, tree.node(100).noveltyRank());
    assertNull(tree.node(1).noveltyRank());
  }

  @Test
  void testUnknownNodeFails() {
    MissingNodeException e = assertThrows(MissingNodeException.class, () -> tree.node(42));
    assertEquals(42, e.getNodeId());
    assertFalse(tree.contains(42));
  }

  @Test
  void testMissingParentFailsOnBuild() {
    TreeFixture fixture = TreeFixture.tree().row(7, 1, "nongtdb", "mag", "SPIRE", null, null);
    MissingNodeException e = assertThrows(MissingNodeException.class, fixture::index);
    assertEquals(7, e.getNodeId());
  }

  @Test
  void testDuplicateRowKeepsTheLastOne() {
    TreeIndex duplicated =
        TreeFixture.tree()
            .row(0, 0, "gtdb", null, null, 0.3, PHYLUM)
            .row(0, 1, "nongtdb", null, null, 0.5, GENUS)
            .row(0, 1, "nongtdb", null, null, 0.6, GENUS)
            .index();

    assertEquals(2, duplicated.size());
    assertEquals(0.6, duplicated.red(1));
    assertEquals(IntArrayList.newListWith(1), duplicated.children(0));
  }
}
