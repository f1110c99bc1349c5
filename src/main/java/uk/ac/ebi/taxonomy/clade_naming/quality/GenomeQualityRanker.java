package uk.ac.ebi.taxonomy.clade_naming.quality;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MissingMetadataException;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeQuality;
import uk.ac.ebi.taxonomy.clade_naming.model.RankedGenome;
import uk.ac.ebi.taxonomy.clade_naming.model.TreeNode;
import uk.ac.ebi.taxonomy.clade_naming.tree.TreeIndex;

/**
 * Orders the query genomes of a tree by naming priority.
 *
 * <p>Genomes are sorted by quality (completeness − 5 × contamination) descending, ties broken by
 * genome id in descending lexicographic order, so the order is total and reproducible.
 */
@Slf4j
@Component
public class GenomeQualityRanker {

  private static final Comparator<RankedGenome> NAMING_PRIORITY =
      Comparator.comparingDouble(RankedGenome::quality)
          .thenComparing(RankedGenome::genomeId)
          .reversed();

  /**
   * Ranks every query genome of the tree.
   *
   * @param tree the indexed tree
   * @param metadata quality metadata keyed by genome id
   * @return query genomes in naming order, with their zero-based position set
   * @throws MissingMetadataException if a query genome has no metadata
   */
  public List<RankedGenome> rank(TreeIndex tree, Map<String, GenomeQuality> metadata) {
    List<RankedGenome> unordered = new ArrayList<>();
    for (TreeNode leaf : tree.queryGenomes()) {
      GenomeQuality quality = metadata.get(leaf.genomeId());
      if (quality == null) {
        throw new MissingMetadataException(leaf.genomeId());
      }
      unordered.add(new RankedGenome(-1, leaf.genomeId(), leaf.nodeId(), quality.quality()));
    }

    unordered.sort(NAMING_PRIORITY);

    List<RankedGenome> ranked = new ArrayList<>(unordered.size());
    for (int i = 0; i < unordered.size(); i++) {
      RankedGenome genome = unordered.get(i);
      ranked.add(new RankedGenome(i, genome.genomeId(), genome.leafNodeId(), genome.quality()));
    }

    if (metadata.size() > ranked.size()) {
      log.warn(
          "{} metadata rows do not belong to query genomes of the tree",
          metadata.size() - ranked.size());
    }
    log.debug("Ranked {} query genomes", ranked.size());
    return List.copyOf(ranked);
  }
}
