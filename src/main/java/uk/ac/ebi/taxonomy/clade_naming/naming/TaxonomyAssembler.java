package uk.ac.ebi.taxonomy.clade_naming.naming;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.collections.api.list.primitive.IntList;
import uk.ac.ebi.taxonomy.clade_naming.Constants;
import uk.ac.ebi.taxonomy.clade_naming.model.CladeNames;
import uk.ac.ebi.taxonomy.clade_naming.model.Domain;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;
import uk.ac.ebi.taxonomy.clade_naming.model.RankedGenome;
import uk.ac.ebi.taxonomy.clade_naming.tree.NoveltyIntervalResolver;
import uk.ac.ebi.taxonomy.clade_naming.tree.TreeIndex;

/**
 * Turns the ranks decided for a genome into its taxonomy string.
 *
 * <p>Three steps run after the ancestor walk: ranks above the highest one held are copied from
 * the genome that founded that clade, open ranks below a held clade are minted after the genome
 * (species from the genus), and the result is rendered behind the domain token.
 */
@Slf4j
public class TaxonomyAssembler {

  private final TreeIndex tree;
  private final NoveltyIntervalResolver resolver;
  private final NamingSession session;
  private final Domain domain;

  TaxonomyAssembler(
      TreeIndex tree, NoveltyIntervalResolver resolver, NamingSession session, Domain domain) {
    this.tree = tree;
    this.resolver = resolver;
    this.session = session;
    this.domain = domain;
  }

  /**
   * Completes and renders the lineage of a genome. Clades minted here are recorded in the
   * session.
   *
   * @return the taxonomy string
   */
  public String assemble(RankedGenome genome, GenomeLineage lineage) {
    Set<Rank> fillable;
    if (lineage.isEmpty()) {
      fillable = EnumSet.allOf(Rank.class);
    } else {
      fillable = EnumSet.noneOf(Rank.class);
      inheritAncestralRanks(genome.genomeId(), lineage);
    }
    backfill(genome, lineage, fillable);
    return render(lineage);
  }

  /**
   * Copies the ranks above the highest held clade from the taxonomy of the genome that founded
   * it. Bare node ids in that taxonomy become reference boundaries.
   */
  private void inheritAncestralRanks(String genomeId, GenomeLineage lineage) {
    Map.Entry<Rank, CladeAssignment> highest = lineage.highest().orElseThrow();
    Rank highestRank = highest.getKey();
    CladeAssignment clade = highest.getValue();
    if (highestRank == Rank.PHYLUM || clade.referenceBoundary()) {
      return;
    }

    Optional<String> founderTaxonomy = session.founderTaxonomy(clade.cladeName());
    if (founderTaxonomy.isEmpty()) {
      log.debug("{}: founder of {} not rendered yet, nothing to inherit", genomeId, clade.cladeName());
      return;
    }

    String taxonomy = founderTaxonomy.get();
    int end = taxonomy.indexOf(Constants.RANK_SEPARATOR + clade.cladeName());
    String ancestral = end < 0 ? taxonomy : taxonomy.substring(0, end);
    String[] tokens = ancestral.split(Constants.RANK_SEPARATOR, -1);
    for (int i = 0; i < tokens.length; i++) {
      String token = tokens[tokens.length - 1 - i];
      int level = highestRank.ordinal() - 1 - i;
      if (level < 0 || token.isEmpty() || token.startsWith(Constants.DOMAIN_PREFIX)) {
        continue;
      }
      CladeAssignment inherited =
          Character.isDigit(token.charAt(0))
              ? CladeAssignment.referenceBoundary(Integer.parseInt(token))
              : CladeAssignment.unanchored(token);
      lineage.assign(Rank.atLevel(level), inherited);
    }
  }

  /**
   * Mints the open ranks the genome may name. A held clade opens every rank whose prefix its name
   * lacks; a reference boundary opens all ranks. A minted rank gets an anchor only when some rank
   * below it was already held.
   */
  private void backfill(RankedGenome genome, GenomeLineage lineage, Set<Rank> fillable) {
    String genomeId = genome.genomeId();
    Set<Rank> held = lineage.assignedRanks();
    String speciesName = null;

    for (Rank rank : Rank.ordered()) {
      Optional<CladeAssignment> current = lineage.get(rank);
      String cladeName = null;

      if (current.isPresent()) {
        if (current.get().referenceBoundary()) {
          fillable = EnumSet.allOf(Rank.class);
          continue;
        }
        cladeName = current.get().cladeName();
        fillable = ranksMissingFrom(cladeName);
      } else if (fillable.contains(rank)) {
        if (rank == Rank.SPECIES) {
          if (speciesName == null) {
            continue;
          }
          cladeName = speciesName;
        } else {
          cladeName = rank.cladeNameFor(genomeId);
        }
        Integer anchor = rank == Rank.SPECIES ? null : anchorFor(rank, cladeName, held, genome);
        lineage.assign(rank, CladeAssignment.clade(anchor, cladeName));
        session.recordClade(anchor, cladeName, genomeId);
      }

      if (rank == Rank.GENUS && cladeName != null) {
        speciesName = CladeNames.speciesFromGenus(cladeName, genomeId);
      }
    }
  }

  private static Set<Rank> ranksMissingFrom(String cladeName) {
    Set<Rank> missing = EnumSet.noneOf(Rank.class);
    for (Rank rank : Rank.ordered()) {
      if (!cladeName.contains(rank.prefix())) {
        missing.add(rank);
      }
    }
    return missing;
  }

  /**
   * Picks the anchor of a backfilled rank: the rootmost ancestor whose query branch spans the
   * rank and which claims nothing at or above it. Only ranks sitting above a held rank are
   * anchored. The chosen node claims the rank in the ledger.
   */
  private Integer anchorFor(Rank rank, String cladeName, Set<Rank> held, RankedGenome genome) {
    if (held.stream().noneMatch(heldRank -> heldRank.isBelow(rank))) {
      return null;
    }
    NodeTaxonomyLedger ledger = session.ledger();
    IntList ancestors = tree.ancestors(genome.leafNodeId());
    Integer anchor = null;
    for (int i = 0; i < ancestors.size(); i++) {
      int ancestor = ancestors.get(i);
      if (resolver.boundsOf(ancestor).spans(rank) && ledger.claimsOnlyBelow(ancestor, rank)) {
        anchor = ancestor;
      }
    }
    if (anchor != null) {
      ledger.claim(anchor, rank, cladeName);
      log.debug("{}: node {} named {}", genome.genomeId(), anchor, cladeName);
    }
    return anchor;
  }

  /** Domain token followed by the held clades; a reference boundary restarts at its node id. */
  private String render(GenomeLineage lineage) {
    StringBuilder taxonomy = new StringBuilder(domain.getToken());
    for (Rank rank : Rank.ordered()) {
      lineage
          .get(rank)
          .ifPresent(
              clade -> {
                if (clade.referenceBoundary()) {
                  taxonomy.setLength(0);
                  taxonomy.append(clade.nodeId());
                } else {
                  taxonomy.append(Constants.RANK_SEPARATOR).append(clade.cladeName());
                }
              });
    }
    return taxonomy.toString();
  }
}
