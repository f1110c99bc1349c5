package uk.ac.ebi.taxonomy.clade_naming.tables;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import uk.ac.ebi.taxonomy.clade_naming.config.NamingConfig;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MalformedTableException;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeQuality;

/**
 * Loads completeness and contamination estimates per genome. Column names come from
 * {@code naming.metadata.*}.
 */
@Component
public class GenomeMetadataLoader {

  private static final Logger LOGGER = LogManager.getLogger(GenomeMetadataLoader.class);

  private final TsvTableReader tableReader;
  private final NamingConfig.Metadata columns;

  public GenomeMetadataLoader(TsvTableReader tableReader, NamingConfig namingConfig) {
    this.tableReader = tableReader;
    this.columns = namingConfig.getMetadata();
  }

  /**
   * Loads the metadata keyed by genome id. A genome listed twice keeps its last row.
   *
   * @throws MalformedTableException if a column is missing or an estimate is not a number
   */
  public Map<String, GenomeQuality> load(Path path) {
    List<Map<String, String>> rows =
        tableReader.readWithHeader(
            path,
            List.of(
                columns.getGenomeColumn(),
                columns.getCompletenessColumn(),
                columns.getContaminationColumn()));

    Map<String, GenomeQuality> metadata = new LinkedHashMap<>();
    int line = 1;
    for (Map<String, String> row : rows) {
      line++;
      String genome = row.get(columns.getGenomeColumn());
      if (genome == null || genome.isEmpty()) {
        LOGGER.warn("Skipping metadata line {} without genome id", line);
        continue;
      }
      GenomeQuality quality =
          new GenomeQuality(
              genome,
              parse(row, columns.getCompletenessColumn(), path, line),
              parse(row, columns.getContaminationColumn(), path, line));
      if (metadata.put(genome, quality) != null) {
        LOGGER.warn("Genome '{}' appears more than once in {}; keeping the last row", genome, path);
      }
    }
    LOGGER.info("Loaded metadata for {} genomes from {}", metadata.size(), path);
    return metadata;
  }

  private static double parse(Map<String, String> row, String column, Path path, int line) {
    String value = row.get(column);
    if (value == null || value.isEmpty()) {
      throw new MalformedTableException(
          "Missing " + column + " in " + path + " at line " + line);
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new MalformedTableException(
          "Invalid " + column + " '" + value + "' in " + path + " at line " + line, e);
    }
  }
}
