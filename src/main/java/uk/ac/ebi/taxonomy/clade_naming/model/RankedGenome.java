package uk.ac.ebi.taxonomy.clade_naming.model;

/**
 * A query genome with its position in naming order.
 *
 * @param order zero-based naming position, best quality first
 * @param genomeId the genome id
 * @param leafNodeId the leaf node holding the genome
 * @param quality completeness − 5 × contamination
 */
public record RankedGenome(int order, String genomeId, int leafNodeId, double quality) {}
