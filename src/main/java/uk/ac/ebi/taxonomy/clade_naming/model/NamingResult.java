package uk.ac.ebi.taxonomy.clade_naming.model;

import java.util.List;
import lombok.Builder;

/**
 * Output of a naming run: one taxonomy per query genome in naming order, and the created clades
 * sorted by clade name.
 */
@Builder
public record NamingResult(List<GenomeTaxonomy> genomes, List<NodeNaming> nodes) {

  public NamingResult {
    genomes = List.copyOf(genomes);
    nodes = List.copyOf(nodes);
  }

  public long pendingCompletionCount() {
    return genomes.stream().filter(GenomeTaxonomy::awaitsCompletion).count();
  }
}
