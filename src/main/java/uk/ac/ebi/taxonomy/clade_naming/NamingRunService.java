package uk.ac.ebi.taxonomy.clade_naming;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.taxonomy.clade_naming.completion.ReferenceTaxonomyCompleter;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.NamingException;
import uk.ac.ebi.taxonomy.clade_naming.model.GenomeQuality;
import uk.ac.ebi.taxonomy.clade_naming.model.NamingRequest;
import uk.ac.ebi.taxonomy.clade_naming.model.NamingResult;
import uk.ac.ebi.taxonomy.clade_naming.model.TreeNode;
import uk.ac.ebi.taxonomy.clade_naming.naming.CladeNamer;
import uk.ac.ebi.taxonomy.clade_naming.tables.GenomeMetadataLoader;
import uk.ac.ebi.taxonomy.clade_naming.tables.NamingOutputWriter;
import uk.ac.ebi.taxonomy.clade_naming.tables.ReferenceTaxonomyLoader;
import uk.ac.ebi.taxonomy.clade_naming.tables.TreeTableLoader;
import uk.ac.ebi.taxonomy.clade_naming.tree.TreeIndex;

/**
 * Runs the naming pipeline end to end.
 *
 * <p>The sequence is:
 *
 * <ol>
 *   <li>Load the tree table, genome metadata and reference taxonomy
 *   <li>Name the clades of the tree
 *   <li>Complete taxonomies that stopped at reference nodes
 *   <li>Write the output tables
 * </ol>
 *
 * <p>Nothing is written unless every earlier step succeeded.
 */
@Slf4j
@Service
public class NamingRunService {

  private final TreeTableLoader treeTableLoader;
  private final GenomeMetadataLoader metadataLoader;
  private final ReferenceTaxonomyLoader referenceTaxonomyLoader;
  private final CladeNamer cladeNamer;
  private final ReferenceTaxonomyCompleter completer;
  private final NamingOutputWriter outputWriter;

  public NamingRunService(
      TreeTableLoader treeTableLoader,
      GenomeMetadataLoader metadataLoader,
      ReferenceTaxonomyLoader referenceTaxonomyLoader,
      CladeNamer cladeNamer,
      ReferenceTaxonomyCompleter completer,
      NamingOutputWriter outputWriter) {
    this.treeTableLoader = treeTableLoader;
    this.metadataLoader = metadataLoader;
    this.referenceTaxonomyLoader = referenceTaxonomyLoader;
    this.cladeNamer = cladeNamer;
    this.completer = completer;
    this.outputWriter = outputWriter;
  }

  /**
   * Executes a naming run.
   *
   * @param request inputs, domain, cutoffs and output directory
   * @return the completed result, as written
   * @throws NamingException if an input violates the pipeline's assumptions or an output cannot
   *     be written
   */
  public NamingResult run(NamingRequest request) {
    log.info("Loading inputs");
    List<TreeNode> rows = treeTableLoader.load(request.treeTable());
    Map<String, GenomeQuality> metadata = metadataLoader.load(request.metadata());
    Map<String, String> referenceTaxonomy =
        referenceTaxonomyLoader.load(request.referenceTaxonomy());
    TreeIndex tree = TreeIndex.build(rows);

    log.info("Naming nodes in tree");
    NamingResult named = cladeNamer.nameClades(tree, metadata, request.domain(), request.cutoffs());

    log.info("Filling taxonomy with reference values");
    NamingResult completed = completer.fillTaxonomy(tree, named, referenceTaxonomy);

    try {
      outputWriter.write(request.outputDirectory(), completed);
    } catch (UncheckedIOException e) {
      throw new NamingException(e.getMessage(), e.getCause());
    }

    log.info("Done");
    return completed;
  }
}
