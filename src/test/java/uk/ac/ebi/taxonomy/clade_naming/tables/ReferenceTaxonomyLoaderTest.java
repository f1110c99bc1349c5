package uk.ac.ebi.taxonomy.clade_naming.tables;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MalformedTableException;

class ReferenceTaxonomyLoaderTest {

  @TempDir Path tempDir;

  private final ReferenceTaxonomyLoader loader = new ReferenceTaxonomyLoader(new TsvTableReader());

  @Test
  void loadsHeaderlessTable() throws IOException {
    Path file = tempDir.resolve("gtdb.tsv");
    Files.writeString(
        file,
        "GB_GCA_1\td__Bacteria;p__Bacteroidota;c__Bacteroidia;o__Bacteroidales;"
            + "f__Azobacteroidaceae;g__Azobacteroides;s__Azobacteroides pseudotrichonymphae_A\n"
            + "\n"
            + "RS_GCF_2\td__Archaea;p__Thermoproteota\n");

    assertThat(loader.load(file))
        .hasSize(2)
        .containsEntry("RS_GCF_2", "d__Archaea;p__Thermoproteota")
        .hasEntrySatisfying(
            "GB_GCA_1", taxonomy -> assertThat(taxonomy).endsWith("s__Azobacteroides pseudotrichonymphae_A"));
  }

  @Test
  void failsOnRowWithoutTaxonomy() throws IOException {
    Path file = tempDir.resolve("gtdb.tsv");
    Files.writeString(file, "GB_GCA_1\td__Bacteria\nGB_GCA_2\n");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(MalformedTableException.class)
        .hasMessageContaining("line 2");
  }
}
