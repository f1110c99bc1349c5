package uk.ac.ebi.taxonomy.clade_naming.naming;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.map.mutable.primitive.IntObjectHashMap;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;

/**
 * Ranks claimed by each node during one naming run, mapping node id to rank to clade name.
 *
 * <p>An entry is written once and never replaced: a genome reaching a node later inherits what
 * earlier genomes claimed there.
 */
public class NodeTaxonomyLedger {

  private final MutableIntObjectMap<Map<Rank, String>> claims = new IntObjectHashMap<>();

  /** Ranks claimed at a node, in rank order, or empty if the node claims nothing. */
  public Optional<Map<Rank, String>> claimsOf(int nodeId) {
    return Optional.ofNullable(claims.get(nodeId)).map(Collections::unmodifiableMap);
  }

  /**
   * Records a claim.
   *
   * @throws IllegalStateException if the node already claims the rank under another name
   */
  public void claim(int nodeId, Rank rank, String cladeName) {
    Map<Rank, String> ranks = claims.getIfAbsentPut(nodeId, () -> new EnumMap<>(Rank.class));
    String existing = ranks.putIfAbsent(rank, cladeName);
    if (existing != null && !existing.equals(cladeName)) {
      throw new IllegalStateException(
          "Node "
              + nodeId
              + " already names "
              + rank
              + " as '"
              + existing
              + "', refusing '"
              + cladeName
              + "'");
    }
  }

  /** True when the node claims no rank at or above {@code rank}. */
  public boolean claimsOnlyBelow(int nodeId, Rank rank) {
    Map<Rank, String> ranks = claims.get(nodeId);
    return ranks == null || ranks.keySet().stream().allMatch(claimed -> claimed.isBelow(rank));
  }

  int size() {
    return claims.size();
  }
}
