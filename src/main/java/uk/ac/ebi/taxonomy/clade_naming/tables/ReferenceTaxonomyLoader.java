package uk.ac.ebi.taxonomy.clade_naming.tables;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MalformedTableException;

/**
 * Loads the reference taxonomy: a headerless table of genome id and taxonomy string, e.g.
 * {@code GB_GCA_000010645.1	d__Bacteria;p__Bacteroidota;...}.
 */
@Component
public class ReferenceTaxonomyLoader {

  private static final Logger LOGGER = LogManager.getLogger(ReferenceTaxonomyLoader.class);

  private final TsvTableReader tableReader;

  public ReferenceTaxonomyLoader(TsvTableReader tableReader) {
    this.tableReader = tableReader;
  }

  /**
   * Loads reference taxonomies keyed by genome id.
   *
   * @throws MalformedTableException if a row has fewer than two fields
   */
  public Map<String, String> load(Path path) {
    List<List<String>> rows = tableReader.readWithoutHeader(path);
    Map<String, String> taxonomy = new HashMap<>(rows.size() * 2);
    int line = 0;
    for (List<String> row : rows) {
      line++;
      if (row.size() < 2) {
        throw new MalformedTableException(
            "Expected genome and taxonomy in " + path + " at line " + line + " but got " + row);
      }
      taxonomy.put(row.get(0), row.get(1));
    }
    LOGGER.info("Loaded {} reference taxonomies from {}", taxonomy.size(), path);
    return taxonomy;
  }
}
