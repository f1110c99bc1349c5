package uk.ac.ebi.taxonomy.clade_naming.naming;

import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.taxonomy.clade_naming.config.NamingConfig;
import uk.ac.ebi.taxonomy.clade_naming.model.Domain;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeQuality;
import uk.ac.ebi.taxonomy.clade_naming.model.NamingResult;
import uk.ac.ebi.taxonomy.clade_naming.model.RankedGenome;
import uk.ac.ebi.taxonomy.clade_naming.model.RedCutoffs;
import uk.ac.ebi.taxonomy.clade_naming.quality.GenomeQualityRanker;
import uk.ac.ebi.taxonomy.clade_naming.tree.NoveltyIntervalResolver;
import uk.ac.ebi.taxonomy.clade_naming.tree.TreeIndex;

/**
 * Names the novel clades of a tree ({@code name_clades}).
 *
 * <p>Query genomes are processed one at a time in quality order. Each genome walks its ancestors
 * through the {@link RankAnchorEngine}, which claims ranks in a ledger shared by the whole run,
 * and is then rendered by the {@link TaxonomyAssembler}. Because of the shared ledger the result
 * depends on the processing order: a better genome names the clades that worse genomes in the
 * same subtree inherit.
 */
@Slf4j
@Service
public class CladeNamer {

  private final GenomeQualityRanker ranker;
  private final NamingConfig namingConfig;

  public CladeNamer(GenomeQualityRanker ranker, NamingConfig namingConfig) {
    this.ranker = ranker;
    this.namingConfig = namingConfig;
  }

  /** Names clades using the configured cutoffs of the domain. */
  public NamingResult nameClades(
      TreeIndex tree, Map<String, GenomeQuality> metadata, Domain domain) {
    return nameClades(tree, metadata, domain, namingConfig.cutoffsFor(domain));
  }

  /**
   * Names clades.
   *
   * @param tree the indexed tree
   * @param metadata quality metadata of the query genomes, keyed by genome id
   * @param domain domain of the tree, gives the token every complete taxonomy starts with
   * @param cutoffs median RED per rank
   * @return taxonomies in naming order and created clades sorted by name; taxonomies that stopped
   *     at a reference node still start with its id
   */
  public NamingResult nameClades(
      TreeIndex tree, Map<String, GenomeQuality> metadata, Domain domain, RedCutoffs cutoffs) {
    List<RankedGenome> genomes = ranker.rank(tree, metadata);
    log.info("Naming {} genomes in {} tree ({} nodes)", genomes.size(), domain, tree.size());
    log.debug("RED cutoffs: {}", cutoffs);

    NamingSession session = new NamingSession();
    NoveltyIntervalResolver resolver = new NoveltyIntervalResolver(tree);
    RankAnchorEngine engine = new RankAnchorEngine(tree, resolver, cutoffs, session);
    TaxonomyAssembler assembler = new TaxonomyAssembler(tree, resolver, session, domain);

    int interval = Math.max(1, namingConfig.getProgressInterval());
    int named = 0;
    for (RankedGenome genome : genomes) {
      log.debug("Determining taxonomy for {}", genome.genomeId());
      GenomeLineage lineage = engine.walk(genome);
      String taxonomy = assembler.assemble(genome, lineage);
      session.recordTaxonomy(genome.genomeId(), taxonomy);
      log.debug("{} -> {}", genome.genomeId(), taxonomy);

      named++;
      if (named % interval == 0) {
        log.info("Named {}/{} genomes", named, genomes.size());
      }
    }

    NamingResult result = session.toResult();
    log.info(
        "Named {} genomes, created {} clades, {} taxonomies wait for reference completion",
        named,
        session.cladeCount(),
        result.pendingCompletionCount());
    return result;
  }
}
