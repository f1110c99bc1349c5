package uk.ac.ebi.taxonomy.clade_naming.tables;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.taxonomy.clade_naming.config.NamingConfig;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeTaxonomy;
import uk.ac.ebi.taxonomy.clade_naming.model.NamingResult;
import uk.ac.ebi.taxonomy.clade_naming.model.NodeNaming;

/**
 * Writes the two output tables of a run into the output directory: genome taxonomies and the
 * created clades. Both are tab-separated with a header; a clade without anchor node has an empty
 * {@code node} field.
 */
@Slf4j
@Component
public class NamingOutputWriter {

  private final CsvMapper mapper = new CsvMapper();
  private final NamingConfig.Output files;

  public NamingOutputWriter(NamingConfig namingConfig) {
    this.files = namingConfig.getOutput();
  }

  /**
   * Creates the output directory if needed and writes both tables.
   *
   * @return paths of the genome taxonomy and node names tables
   * @throws UncheckedIOException if the directory or a file cannot be written
   */
  public List<Path> write(Path outputDirectory, NamingResult result) {
    try {
      Files.createDirectories(outputDirectory);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create output folder " + outputDirectory, e);
    }
    Path genomes = outputDirectory.resolve(files.getGenomeTaxonomyFile());
    Path nodes = outputDirectory.resolve(files.getNodeNamesFile());
    writeRows(genomes, GenomeRow.class, result.genomes(), GenomeRow::of);
    writeRows(nodes, NodeRow.class, result.nodes(), NodeRow::of);
    log.info("Wrote {} genomes to {} and {} clades to {}", result.genomes().size(), genomes,
        result.nodes().size(), nodes);
    return List.of(genomes, nodes);
  }

  private <T, R> void writeRows(Path path, Class<R> rowType, List<T> items, Function<T, R> toRow) {
    CsvSchema schema =
        mapper.schemaFor(rowType).withHeader().withColumnSeparator('\t').withoutQuoteChar();
    try (SequenceWriter writer = mapper.writer(schema).writeValues(path.toFile())) {
      for (T item : items) {
        writer.write(toRow.apply(item));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write " + path, e);
    }
  }

  @JsonPropertyOrder({"genome", "taxonomy"})
  record GenomeRow(
      @JsonProperty("genome") String genome, @JsonProperty("taxonomy") String taxonomy) {

    static GenomeRow of(GenomeTaxonomy taxonomy) {
      return new GenomeRow(taxonomy.genomeId(), taxonomy.taxonomy());
    }
  }

  @JsonPropertyOrder({"node", "clade", "genome_rep"})
  record NodeRow(
      @JsonProperty("node") Integer node,
      @JsonProperty("clade") String clade,
      @JsonProperty("genome_rep") String genomeRep) {

    static NodeRow of(NodeNaming naming) {
      return new NodeRow(naming.nodeId(), naming.cladeName(), naming.genomeRep());
    }
  }
}
