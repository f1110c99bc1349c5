package uk.ac.ebi.taxonomy.clade_naming.tables;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.ebi.taxonomy.clade_naming.config.NamingConfig;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MalformedTableException;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.UnrecognizedNoveltyLabelException;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;
import uk.ac.ebi.taxonomy.clade_naming.model.TreeNode;

class TreeTableLoaderTest {

  private static final String HEADER = "parent\tnode\tnongtdb_group\tgenome\tmagset\tRED\tnovelty_red\n";

  @TempDir Path tempDir;

  private TreeTableLoader loader;

  @BeforeEach
  void setUp() {
    loader = new TreeTableLoader(new TsvTableReader(), new NamingConfig());
  }

  private Path write(String content) throws IOException {
    Path file = tempDir.resolve("tree.tsv");
    Files.writeString(file, content);
    return file;
  }

  @Test
  void loadsRowsInFileOrder() throws IOException {
    Path file =
        write(
            HEADER
                + "10\t1\tnongtdb\tmag_1\tSPIRE\tNA\tNA\n"
                + "1e+05\t10\tnongtdb\tNA\tNA\t0.97\tSpecies/Strain (0.95-1]\n"
                + "100000\t100000\tgtdb\t\t\t0.3\tPhylum (0-0.28]\n");

    List<TreeNode> nodes = loader.load(file);

    assertThat(nodes)
        .containsExactly(
            TreeNode.builder()
                .parentId(10)
                .nodeId(1)
                .referenceGroup("nongtdb")
                .genomeId("mag_1")
                .magset("SPIRE")
                .build(),
            TreeNode.builder()
                .parentId(100000)
                .nodeId(10)
                .referenceGroup("nongtdb")
                .red(0.97)
                .noveltyRank(Rank.SPECIES)
                .build(),
            TreeNode.builder()
                .parentId(100000)
                .nodeId(100000)
                .referenceGroup("gtdb")
                .red(0.3)
                .noveltyRank(Rank.PHYLUM)
                .build());
    assertThat(nodes.get(2).isRoot()).isTrue();
  }

  @Test
  void ignoresExtraColumns() throws IOException {
    Path file =
        write(
            "parent\tnode\tnongtdb_group\tgenome\tmagset\tRED\tnovelty_red\tdepth\n"
                + "0\t0\tgtdb\tNA\tNA\t0.3\tPhylum (0-0.28]\t0\n");

    assertThat(loader.load(file)).singleElement().extracting(TreeNode::nodeId).isEqualTo(0);
  }

  @Test
  void failsOnMissingColumn() throws IOException {
    Path file = write("parent\tnode\tgenome\n0\t0\tNA\n");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(MalformedTableException.class)
        .hasMessageContaining("nongtdb_group");
  }

  @Test
  void failsOnInvalidNumber() throws IOException {
    Path file = write(HEADER + "0\t0\tgtdb\tNA\tNA\thigh\tNA\n");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(MalformedTableException.class)
        .hasMessageContaining("line 2");
  }

  @Test
  void failsOnUnknownNoveltyLabel() throws IOException {
    Path file = write(HEADER + "0\t0\tgtdb\tNA\tNA\t0.3\tKingdom (0-0.1]\n");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(UnrecognizedNoveltyLabelException.class);
  }

  @Test
  void failsOnMissingFile() {
    assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.tsv")))
        .isInstanceOf(MalformedTableException.class)
        .hasMessageContaining("absent.tsv");
  }
}
