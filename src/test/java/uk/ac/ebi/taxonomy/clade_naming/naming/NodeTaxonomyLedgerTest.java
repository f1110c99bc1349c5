package uk.ac.ebi.taxonomy.clade_naming.naming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;

class NodeTaxonomyLedgerTest {

  private final NodeTaxonomyLedger ledger = new NodeTaxonomyLedger();

  @Test
  void claimsAreKeptInRankOrder() {
    ledger.claim(10, Rank.FAMILY, "f__MAG1");
    ledger.claim(10, Rank.ORDER, "o__MAG1");

    assertThat(ledger.claimsOf(10))
        .hasValueSatisfying(
            claims ->
                assertThat(claims)
                    .containsExactly(entry(Rank.ORDER, "o__MAG1"), entry(Rank.FAMILY, "f__MAG1")));
    assertThat(ledger.claimsOf(11)).isEmpty();
    assertThat(ledger.size()).isEqualTo(1);
  }

  @Test
  void repeatedClaimWithSameNameIsAccepted() {
    ledger.claim(10, Rank.GENUS, "g__MAG1");
    ledger.claim(10, Rank.GENUS, "g__MAG1");

    assertThat(ledger.claimsOf(10).orElseThrow()).hasSize(1);
  }

  @Test
  void conflictingClaimIsRefused() {
    ledger.claim(10, Rank.GENUS, "g__MAG1");

    assertThatThrownBy(() -> ledger.claim(10, Rank.GENUS, "g__MAG2"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("g__MAG1");
  }

  @Test
  void claimsOnlyBelowLooksAtEveryClaimedRank() {
    ledger.claim(10, Rank.GENUS, "g__MAG1");

    assertThat(ledger.claimsOnlyBelow(10, Rank.FAMILY)).isTrue();
    assertThat(ledger.claimsOnlyBelow(10, Rank.GENUS)).isFalse();
    assertThat(ledger.claimsOnlyBelow(99, Rank.PHYLUM)).isTrue();
  }

  @Test
  void exposedClaimsCannotBeModified() {
    ledger.claim(10, Rank.GENUS, "g__MAG1");

    assertThatThrownBy(() -> ledger.claimsOf(10).orElseThrow().put(Rank.SPECIES, "s__x"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
