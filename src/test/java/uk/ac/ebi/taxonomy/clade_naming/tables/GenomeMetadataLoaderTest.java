package uk.ac.ebi.taxonomy.clade_naming.tables;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.ebi.taxonomy.clade_naming.config.NamingConfig;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MalformedTableException;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeQuality;

class GenomeMetadataLoaderTest {

  @TempDir Path tempDir;

  private final NamingConfig namingConfig = new NamingConfig();

  private Path write(String content) throws IOException {
    Path file = tempDir.resolve("metadata.tsv");
    Files.writeString(file, content);
    return file;
  }

  @Test
  void testLoadKeepsFileOrderAndLastDuplicate() throws IOException {
    Path file =
        write(
            "ID\tcheckm2_completeness\tcheckm2_contamination\tsize\n"
                + "mag_1\t90.5\t1.2\t100\n"
                + "mag_2\t80\t0\t200\n"
                + "mag_1\t91\t1\t100\n");

    Map<String, GenomeQuality> metadata =
        new GenomeMetadataLoader(new TsvTableReader(), namingConfig).load(file);

    assertEquals(List.of("mag_1", "mag_2"), List.copyOf(metadata.keySet()));
    assertEquals(new GenomeQuality("mag_1", 91.0, 1.0), metadata.get("mag_1"));
    assertEquals(80.0, metadata.get("mag_2").quality());
  }

  @Test
  void testConfiguredColumnNames() throws IOException {
    namingConfig.getMetadata().setGenomeColumn("Name");
    namingConfig.getMetadata().setCompletenessColumn("Completeness");
    namingConfig.getMetadata().setContaminationColumn("Contamination");
    Path file = write("Name\tCompleteness\tContamination\nmag_1\t95\t2\n");

    Map<String, GenomeQuality> metadata =
        new GenomeMetadataLoader(new TsvTableReader(), namingConfig).load(file);

    assertEquals(85.0, metadata.get("mag_1").quality());
  }

  @Test
  void testMissingEstimateFails() throws IOException {
    Path file = write("ID\tcheckm2_completeness\tcheckm2_contamination\nmag_1\t\t2\n");
    GenomeMetadataLoader loader = new GenomeMetadataLoader(new TsvTableReader(), namingConfig);

    MalformedTableException e = assertThrows(MalformedTableException.class, () -> loader.load(file));
    assertTrue(e.getMessage().contains("checkm2_completeness"));
  }

  @Test
  void testInvalidEstimateFails() throws IOException {
    Path file = write("ID\tcheckm2_completeness\tcheckm2_contamination\nmag_1\t95\tlow\n");
    GenomeMetadataLoader loader = new GenomeMetadataLoader(new TsvTableReader(), namingConfig);

    assertThrows(MalformedTableException.class, () -> loader.load(file));
  }
}
