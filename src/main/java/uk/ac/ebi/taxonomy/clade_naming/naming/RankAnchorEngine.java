package uk.ac.ebi.taxonomy.clade_naming.naming;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.collections.api.list.primitive.IntList;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.NamingException;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;
import uk.ac.ebi.taxonomy.clade_naming.model.RankedGenome;
import uk.ac.ebi.taxonomy.clade_naming.model.RedCutoffs;
import uk.ac.ebi.taxonomy.clade_naming.tree.NoveltyBounds;
import uk.ac.ebi.taxonomy.clade_naming.tree.NoveltyIntervalResolver;
import uk.ac.ebi.taxonomy.clade_naming.tree.TreeIndex;

/**
 * Walks the ancestor path of a genome from its parent towards the root and decides which
 * ancestor anchors each rank.
 *
 * <p>At every ancestor the engine:
 *
 * <ol>
 *   <li>skips a same-rank ancestor that has an internal child opening the same rank on a branch
 *       whose RED sits strictly closer to the rank median;
 *   <li>settles the pending candidate left by the previous ancestor: when both contest the same
 *       rank the one closer to the median wins, otherwise the candidate is named;
 *   <li>stops at an ancestor already present in the ledger, inheriting its ranks;
 *   <li>stops at a reference ancestor, recording the rank just above the boundary it marks;
 *   <li>otherwise proposes the ancestor as the next pending candidate.
 * </ol>
 *
 * <p>Names minted here are written to the shared ledger. Ranks left open are filled later by the
 * {@link TaxonomyAssembler}.
 */
@Slf4j
public class RankAnchorEngine {

  private final TreeIndex tree;
  private final NoveltyIntervalResolver resolver;
  private final RedCutoffs cutoffs;
  private final NamingSession session;

  RankAnchorEngine(
      TreeIndex tree, NoveltyIntervalResolver resolver, RedCutoffs cutoffs, NamingSession session) {
    this.tree = tree;
    this.resolver = resolver;
    this.cutoffs = cutoffs;
    this.session = session;
  }

  /**
   * Walks the ancestors of one genome.
   *
   * @param genome the genome being named
   * @return ranks decided during the walk
   * @throws NamingException if an ancestor reached has no novelty label, an empty rank interval
   *     or no RED value
   */
  public GenomeLineage walk(RankedGenome genome) {
    String genomeId = genome.genomeId();
    GenomeLineage lineage = new GenomeLineage();
    IntList ancestors = tree.ancestors(genome.leafNodeId());
    Optional<PendingCandidate> pending = Optional.empty();

    for (int i = 0; i < ancestors.size(); i++) {
      int ancestor = ancestors.get(i);
      NoveltyBounds bounds = resolver.boundsOf(ancestor);
      boolean reference = bounds.isReference();
      boolean skip = false;

      switch (bounds.kind()) {
        case UNLABELLED -> throw new NamingException(
            "Ancestor " + ancestor + " of genome " + genomeId + " carries no novelty label");
        case SAME_RANK -> skip = hasCloserSibling(ancestor, bounds.self(), pending);
        default -> {
          // range and reference branches have no siblings to compare against
        }
      }
      List<Rank> ranks = bounds.candidateRanks();

      if (pending.isPresent()) {
        PendingCandidate candidate = pending.get();
        Rank contested = reference ? bounds.self() : requireRanks(ranks, ancestor).get(0);
        if (candidate.head() != contested) {
          mint(candidate, lineage, genomeId);
        } else if (cutoffs.isCloser(
            tree.branchRed(candidate.nodeId()), tree.branchRed(ancestor), contested)) {
          mint(candidate, lineage, genomeId);
          skip = !reference;
        } else {
          PendingCandidate remainder = candidate.withoutHead();
          if (remainder.ranks().size() > 1) {
            mint(remainder, lineage, genomeId);
          }
        }
        pending = Optional.empty();
      }

      if (skip) {
        log.debug("{}: skipping ancestor {}", genomeId, ancestor);
        continue;
      }

      Optional<Map<Rank, String>> claimed = session.ledger().claimsOf(ancestor);
      if (claimed.isPresent()) {
        log.debug("{}: inheriting {} from node {}", genomeId, claimed.get(), ancestor);
        claimed
            .get()
            .forEach((rank, name) -> lineage.assign(rank, CladeAssignment.clade(ancestor, name)));
        break;
      }

      if (reference) {
        stopAtReference(ancestor, bounds.self(), lineage, genomeId);
        break;
      }

      pending = Optional.of(new PendingCandidate(ancestor, requireRanks(ranks, ancestor)));
    }
    return lineage;
  }

  /**
   * True when an internal child of {@code ancestor}, other than the pending candidate, opens the
   * same rank on a branch strictly closer to the rank median than the ancestor's own branch.
   */
  private boolean hasCloserSibling(int ancestor, Rank rank, Optional<PendingCandidate> pending) {
    double ancestorRed = tree.branchRed(ancestor);
    return tree.children(ancestor)
        .anySatisfy(
            child ->
                !isPending(child, pending)
                    && !tree.node(child).isLeaf()
                    && resolver.boundsOf(child).upper() == rank
                    && cutoffs.isCloser(tree.branchRed(child), ancestorRed, rank));
  }

  private static boolean isPending(int nodeId, Optional<PendingCandidate> pending) {
    return pending.map(candidate -> candidate.nodeId() == nodeId).orElse(false);
  }

  /**
   * Records the boundary a reference ancestor marks. The ancestor's label gives the rank it
   * opens; when its own RED is not closer to that rank's median than its branch, the boundary
   * moves one rank down. The rank above the boundary is then held by the reference node, unless
   * the boundary is at phylum.
   */
  private void stopAtReference(int ancestor, Rank label, GenomeLineage lineage, String genomeId) {
    int level = label.ordinal();
    if (!cutoffs.isCloser(tree.red(ancestor), tree.branchRed(ancestor), label)) {
      level++;
    }
    if (level == 0) {
      log.debug("{}: reached reference node {} at phylum novelty", genomeId, ancestor);
      return;
    }
    Rank boundary = Rank.atLevel(level - 1);
    log.debug("{}: reference node {} holds {}", genomeId, ancestor, boundary);
    lineage.assign(boundary, CladeAssignment.referenceBoundary(ancestor));
  }

  /** Names every open, non-species rank of a candidate after the genome. */
  private void mint(PendingCandidate candidate, GenomeLineage lineage, String genomeId) {
    for (Rank rank : candidate.ranks()) {
      if (rank == Rank.SPECIES || lineage.isAssigned(rank)) {
        continue;
      }
      String cladeName = rank.cladeNameFor(genomeId);
      lineage.assign(rank, CladeAssignment.clade(candidate.nodeId(), cladeName));
      session.recordClade(candidate.nodeId(), cladeName, genomeId);
      session.ledger().claim(candidate.nodeId(), rank, cladeName);
      log.debug("{}: node {} named {}", genomeId, candidate.nodeId(), cladeName);
    }
  }

  private static List<Rank> requireRanks(List<Rank> ranks, int ancestor) {
    if (ranks.isEmpty()) {
      throw new NamingException("Node " + ancestor + " has an empty novelty interval");
    }
    return ranks;
  }
}
