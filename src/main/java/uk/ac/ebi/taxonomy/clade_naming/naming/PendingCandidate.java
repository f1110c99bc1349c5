package uk.ac.ebi.taxonomy.clade_naming.naming;

import java.util.List;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;

/**
 * An ancestor proposed to anchor some ranks, waiting for the next ancestor up to decide whether
 * it or the candidate sits closer to the rank median.
 *
 * @param nodeId the proposed anchor
 * @param ranks ranks proposed, highest first
 */
public record PendingCandidate(int nodeId, List<Rank> ranks) {

  public PendingCandidate {
    ranks = List.copyOf(ranks);
  }

  public Rank head() {
    return ranks.get(0);
  }

  /** The same candidate without its highest rank. */
  public PendingCandidate withoutHead() {
    return new PendingCandidate(nodeId, ranks.subList(1, ranks.size()));
  }
}
