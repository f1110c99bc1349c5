package uk.ac.ebi.taxonomy.clade_naming.tree;

import java.util.List;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;

/**
 * Ranks a branch can stand for, from the novelty label above it ({@code upper}, the parent's
 * label) to the label of the node itself ({@code self}).
 *
 * <p>A reference branch has no upper bound. An unlabelled branch has neither.
 *
 * @param upper rank of the parent's label, null on reference or unlabelled branches
 * @param self rank of the node's own label, null when unlabelled
 */
public record NoveltyBounds(Rank upper, Rank self) {

  public static final NoveltyBounds UNLABELLED = new NoveltyBounds(null, null);

  public enum Kind {
    /** Parent and node carry the same rank: the branch can only stand for that rank. */
    SAME_RANK,
    /** The branch spans the ranks from the parent's label down to, but not including, its own. */
    RANGE,
    /** Reference branch: only the node's own label is known. */
    REFERENCE,
    UNLABELLED
  }

  public Kind kind() {
    if (self == null) {
      return Kind.UNLABELLED;
    }
    if (upper == null) {
      return Kind.REFERENCE;
    }
    return upper == self ? Kind.SAME_RANK : Kind.RANGE;
  }

  public boolean isReference() {
    return kind() == Kind.REFERENCE;
  }

  /**
   * Ranks the branch may anchor: the single rank of a same-rank branch, the half-open interval
   * {@code [upper, self)} of a range branch, nothing otherwise. An inverted range is empty.
   */
  public List<Rank> candidateRanks() {
    return switch (kind()) {
      case SAME_RANK -> List.of(self);
      case RANGE -> Rank.between(upper, self);
      default -> List.of();
    };
  }

  /** True on non-reference branches whose closed interval {@code [upper, self]} holds the rank. */
  public boolean spans(Rank rank) {
    return upper != null && self != null && !rank.isAbove(upper) && !rank.isBelow(self);
  }

  @Override
  public String toString() {
    return "(" + (upper == null ? "" : upper) + ", " + (self == null ? "" : self) + ")";
  }
}
