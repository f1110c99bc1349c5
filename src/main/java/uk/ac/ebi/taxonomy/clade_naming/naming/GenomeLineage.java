package uk.ac.ebi.taxonomy.clade_naming.naming;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;

/** Per-genome working state: what the genome holds at each rank while it is being named. */
public class GenomeLineage {

  private final EnumMap<Rank, CladeAssignment> assignments = new EnumMap<>(Rank.class);

  public Optional<CladeAssignment> get(Rank rank) {
    return Optional.ofNullable(assignments.get(rank));
  }

  public boolean isAssigned(Rank rank) {
    return assignments.containsKey(rank);
  }

  public void assign(Rank rank, CladeAssignment assignment) {
    assignments.put(rank, assignment);
  }

  public boolean isEmpty() {
    return assignments.isEmpty();
  }

  /** The highest assigned rank with its assignment. */
  public Optional<Map.Entry<Rank, CladeAssignment>> highest() {
    return assignments.entrySet().stream().findFirst();
  }

  public Set<Rank> assignedRanks() {
    return assignments.isEmpty() ? EnumSet.noneOf(Rank.class) : EnumSet.copyOf(assignments.keySet());
  }

  @Override
  public String toString() {
    return assignments.toString();
  }
}
