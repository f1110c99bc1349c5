package uk.ac.ebi.taxonomy.clade_naming.model;

import java.nio.file.Path;
import lombok.Builder;

/**
 * Inputs and parameters of one naming run.
 *
 * @param treeTable annotated tree table
 * @param metadata genome quality metadata
 * @param referenceTaxonomy headerless reference taxonomy table
 * @param domain domain of the tree
 * @param cutoffs median RED per rank
 * @param outputDirectory directory receiving the output tables
 */
@Builder
public record NamingRequest(
    Path treeTable,
    Path metadata,
    Path referenceTaxonomy,
    Domain domain,
    RedCutoffs cutoffs,
    Path outputDirectory) {}
