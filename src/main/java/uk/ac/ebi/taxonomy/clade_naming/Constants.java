package uk.ac.ebi.taxonomy.clade_naming;

/**
 * A utility class holding application-wide constant values used across the naming pipeline.
 * This class is non-instantiable.
 */
public final class Constants {

  /** Reference group value marking a branch that belongs to the reference (GTDB) tree. */
  public static final String REFERENCE_GROUP = "gtdb";

  /** Magset value marking a reference genome; any other non-null magset is a query genome. */
  public static final String REFERENCE_MAGSET = "GTDB";

  /** Separator between the clades of a rendered taxonomy string. */
  public static final String RANK_SEPARATOR = ";";

  /** Prefix of a domain token; taxonomies without it still wait for the completion pass. */
  public static final String DOMAIN_PREFIX = "d__";

  // Tree table columns, as written by the tree-to-table export
  public static final String PARENT_COLUMN = "parent";
  public static final String NODE_COLUMN = "node";
  public static final String GROUP_COLUMN = "nongtdb_group";
  public static final String GENOME_COLUMN = "genome";
  public static final String MAGSET_COLUMN = "magset";
  public static final String RED_COLUMN = "RED";
  public static final String NOVELTY_COLUMN = "novelty_red";

  // Output table columns
  public static final String TAXONOMY_COLUMN = "taxonomy";
  public static final String CLADE_COLUMN = "clade";
  public static final String GENOME_REP_COLUMN = "genome_rep";

  // Private constructor to prevent instantiation
  private Constants() {
    throw new UnsupportedOperationException("Constants class cannot be instantiated");
  }
}
