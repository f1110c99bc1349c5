package uk.ac.ebi.taxonomy.clade_naming.completion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.collections.api.iterator.IntIterator;
import org.springframework.stereotype.Service;
import uk.ac.ebi.taxonomy.clade_naming.Constants;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.NamingException;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.NoReferenceDescendantException;
import uk.ac.ebi.taxonomy.clade_naming.model.CladeNames;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeTaxonomy;
import uk.ac.ebi.taxonomy.clade_naming.model.NamingResult;
import uk.ac.ebi.taxonomy.clade_naming.model.NodeNaming;
import uk.ac.ebi.taxonomy.clade_naming.tree.TreeIndex;

/**
 * Completes taxonomies that stopped at a reference node ({@code fill_taxonomy}).
 *
 * <p>Such a taxonomy starts with the node id, followed by the ranks named below it. The ranks
 * above are taken from the reference genomes under that node: each contributes the part of its
 * taxonomy before the first rank the genome already names, and the lineage shared by most of them
 * is used. A genome with nothing named below the node also gets a species derived from the
 * completed genus.
 */
@Slf4j
@Service
public class ReferenceTaxonomyCompleter {

  private static final int RANK_PREFIX_LENGTH = 3;

  private static final Comparator<Map.Entry<String, Integer>> MOST_SHARED =
      Map.Entry.<String, Integer>comparingByValue()
          .reversed()
          .thenComparing(Map.Entry.<String, Integer>comparingByKey());

  /**
   * Completes the pending taxonomies of a naming result.
   *
   * @param tree the indexed tree
   * @param named result of clade naming
   * @param referenceTaxonomy taxonomy strings of reference genomes, keyed by genome id
   * @return the result with every taxonomy starting at the domain, and the derived species added
   *     to the clade list, re-sorted by clade name
   * @throws NoReferenceDescendantException if a reference node has no usable reference genome
   *     below it
   */
  public NamingResult fillTaxonomy(
      TreeIndex tree, NamingResult named, Map<String, String> referenceTaxonomy) {
    Map<LineageKey, String> lineages = new HashMap<>();
    List<GenomeTaxonomy> genomes = new ArrayList<>(named.genomes().size());
    List<NodeNaming> nodes = new ArrayList<>(named.nodes());
    int completed = 0;

    for (GenomeTaxonomy genome : named.genomes()) {
      if (!genome.awaitsCompletion()) {
        genomes.add(genome);
        continue;
      }

      String[] parts = genome.taxonomy().split(Constants.RANK_SEPARATOR, -1);
      int nodeId = parseNodeId(parts[0], genome.genomeId());
      String namedRanks =
          String.join(Constants.RANK_SEPARATOR, Arrays.asList(parts).subList(1, parts.length));
      String limit = namedRanks.substring(0, Math.min(RANK_PREFIX_LENGTH, namedRanks.length()));

      String lineage =
          lineages.computeIfAbsent(
              new LineageKey(nodeId, limit),
              key -> referenceLineage(tree, key, referenceTaxonomy));

      if (namedRanks.isEmpty()) {
        namedRanks = CladeNames.speciesFromGenus(lineage, genome.genomeId());
        nodes.add(NodeNaming.unanchored(namedRanks, genome.genomeId()));
      }
      genomes.add(
          new GenomeTaxonomy(genome.genomeId(), lineage + Constants.RANK_SEPARATOR + namedRanks));
      completed++;
    }

    nodes.sort(NodeNaming.BY_CLADE);
    log.info("Completed {} taxonomies from {} reference lineages", completed, lineages.size());
    return new NamingResult(genomes, nodes);
  }

  /**
   * Most shared lineage prefix among the reference genomes under a node: the text before the
   * last {@code ;<limit>} of each taxonomy, ties resolved alphabetically.
   */
  private String referenceLineage(
      TreeIndex tree, LineageKey key, Map<String, String> referenceTaxonomy) {
    Pattern prefix = Pattern.compile("(.*)" + Pattern.quote(Constants.RANK_SEPARATOR + key.limit()));
    Map<String, Integer> votes = new HashMap<>();

    IntIterator descendants = tree.descendants(key.nodeId()).intIterator();
    while (descendants.hasNext()) {
      String genomeId = tree.node(descendants.next()).genomeId();
      String taxonomy = genomeId == null ? null : referenceTaxonomy.get(genomeId);
      if (taxonomy == null) {
        continue;
      }
      Matcher matcher = prefix.matcher(taxonomy);
      if (matcher.find()) {
        votes.merge(matcher.group(1), 1, Integer::sum);
      }
    }

    if (votes.isEmpty()) {
      throw new NoReferenceDescendantException(key.nodeId(), key.limit());
    }
    if (votes.size() > 1) {
      log.debug("Node {} has competing reference lineages {}", key.nodeId(), votes);
    }
    return votes.entrySet().stream().min(MOST_SHARED).orElseThrow().getKey();
  }

  private static int parseNodeId(String token, String genomeId) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new NamingException(
          "Taxonomy of " + genomeId + " starts with neither a domain nor a node id: " + token, e);
    }
  }

  private record LineageKey(int nodeId, String limit) {}
}
