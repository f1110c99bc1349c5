package uk.ac.ebi.taxonomy.clade_naming.naming;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeTaxonomy;
import uk.ac.ebi.taxonomy.clade_naming.model.NamingResult;
import uk.ac.ebi.taxonomy.clade_naming.model.NodeNaming;

/**
 * State shared by all genomes of one naming run: the ledger of claimed ranks and the outputs
 * accumulated so far.
 */
class NamingSession {

  private final NodeTaxonomyLedger ledger = new NodeTaxonomyLedger();
  private final List<NodeNaming> nodes = new ArrayList<>();
  private final List<GenomeTaxonomy> genomes = new ArrayList<>();
  // clade name -> genome that created it
  private final Map<String, String> founders = new HashMap<>();
  private final Map<String, String> taxonomies = new HashMap<>();

  NodeTaxonomyLedger ledger() {
    return ledger;
  }

  void recordClade(Integer nodeId, String cladeName, String genomeId) {
    nodes.add(new NodeNaming(nodeId, cladeName, genomeId));
    founders.putIfAbsent(cladeName, genomeId);
  }

  void recordTaxonomy(String genomeId, String taxonomy) {
    genomes.add(new GenomeTaxonomy(genomeId, taxonomy));
    taxonomies.putIfAbsent(genomeId, taxonomy);
  }

  /**
   * Rendered taxonomy of the genome that created a clade. Empty if that genome has not been
   * rendered yet.
   */
  Optional<String> founderTaxonomy(String cladeName) {
    return Optional.ofNullable(founders.get(cladeName)).map(taxonomies::get);
  }

  int cladeCount() {
    return nodes.size();
  }

  NamingResult toResult() {
    List<NodeNaming> sorted = new ArrayList<>(nodes);
    sorted.sort(NodeNaming.BY_CLADE);
    return new NamingResult(genomes, sorted);
  }
}
