package uk.ac.ebi.taxonomy.clade_naming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeQuality;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeTaxonomy;
import uk.ac.ebi.taxonomy.clade_naming.model.NodeNaming;
import uk.ac.ebi.taxonomy.clade_naming.model.TreeNode;
import uk.ac.ebi.taxonomy.clade_naming.tree.NoveltyLabels;
import uk.ac.ebi.taxonomy.clade_naming.tree.TreeIndex;

/** Builds small trees and genome metadata for tests. */
public final class TreeFixture {

  public static final String SPECIES = "Species/Strain (0.95-1]";
  public static final String GENUS = "Genus (0.82-0.95]";
  public static final String FAMILY = "Family (0.62-0.82]";
  public static final String ORDER = "Order (0.43-0.62]";
  public static final String CLASS = "Class (0.28-0.43]";
  public static final String PHYLUM = "Phylum (0-0.28]";

  private final List<TreeNode> rows = new ArrayList<>();
  private final Map<String, GenomeQuality> metadata = new LinkedHashMap<>();

  private TreeFixture() {}

  public static TreeFixture tree() {
    return new TreeFixture();
  }

  public TreeFixture row(
      int parent, int node, String group, String genome, String magset, Double red, String label) {
    rows.add(
        TreeNode.builder()
            .parentId(parent)
            .nodeId(node)
            .referenceGroup(group)
            .genomeId(genome)
            .magset(magset)
            .red(red)
            .noveltyRank(NoveltyLabels.parse(label))
            .build());
    return this;
  }

  public TreeFixture quality(String genome, double completeness, double contamination) {
    metadata.put(genome, new GenomeQuality(genome, completeness, contamination));
    return this;
  }

  public List<TreeNode> rows() {
    return rows;
  }

  public TreeIndex index() {
    return TreeIndex.build(rows);
  }

  public Map<String, GenomeQuality> metadata() {
    return metadata;
  }

  public static GenomeTaxonomy genome(String genomeId, String taxonomy) {
    return new GenomeTaxonomy(genomeId, taxonomy);
  }

  public static NodeNaming node(Integer nodeId, String cladeName, String genomeRep) {
    return new NodeNaming(nodeId, cladeName, genomeRep);
  }
}
