package uk.ac.ebi.taxonomy.clade_naming.tables;

import static uk.ac.ebi.taxonomy.clade_naming.Constants.GENOME_COLUMN;
import static uk.ac.ebi.taxonomy.clade_naming.Constants.GROUP_COLUMN;
import static uk.ac.ebi.taxonomy.clade_naming.Constants.MAGSET_COLUMN;
import static uk.ac.ebi.taxonomy.clade_naming.Constants.NODE_COLUMN;
import static uk.ac.ebi.taxonomy.clade_naming.Constants.NOVELTY_COLUMN;
import static uk.ac.ebi.taxonomy.clade_naming.Constants.PARENT_COLUMN;
import static uk.ac.ebi.taxonomy.clade_naming.Constants.RED_COLUMN;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import uk.ac.ebi.taxonomy.clade_naming.config.NamingConfig;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MalformedTableException;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.UnrecognizedNoveltyLabelException;
import uk.ac.ebi.taxonomy.clade_naming.model.TreeNode;
import uk.ac.ebi.taxonomy.clade_naming.tree.NoveltyLabels;

/**
 * Loads the annotated tree table exported from the phylogenetic tree.
 *
 * <p>Expected columns are {@code parent}, {@code node}, {@code nongtdb_group}, {@code genome},
 * {@code magset}, {@code RED} and {@code novelty_red}; other columns are ignored. Missing values
 * are written as {@code NA} (configurable) or left empty.
 */
@Component
public class TreeTableLoader {

  private static final Logger LOGGER = LogManager.getLogger(TreeTableLoader.class);

  private static final List<String> REQUIRED_COLUMNS =
      List.of(
          PARENT_COLUMN,
          NODE_COLUMN,
          GROUP_COLUMN,
          GENOME_COLUMN,
          MAGSET_COLUMN,
          RED_COLUMN,
          NOVELTY_COLUMN);

  private final TsvTableReader tableReader;
  private final Set<String> nullValues;

  public TreeTableLoader(TsvTableReader tableReader, NamingConfig namingConfig) {
    this.tableReader = tableReader;
    this.nullValues = new HashSet<>(namingConfig.getTree().getNullValues());
  }

  /**
   * Loads the tree rows in file order.
   *
   * @throws MalformedTableException if a column is missing or a value cannot be parsed
   * @throws UnrecognizedNoveltyLabelException if a novelty label names no known rank
   */
  public List<TreeNode> load(Path path) {
    List<Map<String, String>> rows = tableReader.readWithHeader(path, REQUIRED_COLUMNS);
    List<TreeNode> nodes = new ArrayList<>(rows.size());
    int line = 1;
    for (Map<String, String> row : rows) {
      line++;
      try {
        nodes.add(toNode(row));
      } catch (NumberFormatException | ArithmeticException e) {
        throw new MalformedTableException(
            "Invalid number in " + path + " at line " + line + ": " + e.getMessage(), e);
      }
    }
    LOGGER.info("Loaded {} tree nodes from {}", nodes.size(), path);
    return nodes;
  }

  private TreeNode toNode(Map<String, String> row) {
    Integer node = parseId(value(row, NODE_COLUMN));
    Integer parent = parseId(value(row, PARENT_COLUMN));
    if (node == null || parent == null) {
      throw new MalformedTableException("Tree row without node or parent id: " + row);
    }
    String red = value(row, RED_COLUMN);
    return TreeNode.builder()
        .nodeId(node)
        .parentId(parent)
        .referenceGroup(value(row, GROUP_COLUMN))
        .genomeId(value(row, GENOME_COLUMN))
        .magset(value(row, MAGSET_COLUMN))
        .red(red == null ? null : Double.valueOf(red))
        .noveltyRank(NoveltyLabels.parse(value(row, NOVELTY_COLUMN)))
        .build();
  }

  private String value(Map<String, String> row, String column) {
    String value = row.get(column);
    if (value == null || value.isEmpty() || nullValues.contains(value)) {
      return null;
    }
    return value;
  }

  // ids may have been written in scientific notation, e.g. 1e+05
  private static Integer parseId(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException e) {
      return new BigDecimal(value).intValueExact();
    }
  }
}
