package uk.ac.ebi.taxonomy.clade_naming.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import uk.ac.ebi.taxonomy.clade_naming.model.Domain;
import uk.ac.ebi.taxonomy.clade_naming.model.RedCutoffs;

/**
 * Configuration properties for a naming run.
 *
 * <p>Values are loaded from {@code application.properties} (prefix {@code naming.*}). Command-line
 * options override them per run.
 */
@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "naming")
public class NamingConfig {

  /** Default domain token, {@code d__Bacteria} or {@code d__Archaea}. */
  private String domain = Domain.BACTERIA.getToken();

  /**
   * Optional override of the median RED values of phylum, class, order, family and genus. Empty
   * to use the domain defaults.
   */
  private List<Double> redCutoffs = new ArrayList<>();

  /** Number of genomes between two progress log lines. */
  private int progressInterval = 1000;

  private Tree tree = new Tree();

  private Metadata metadata = new Metadata();

  private Output output = new Output();

  @PostConstruct
  public void init() {
    if (Domain.fromName(domain) == null) {
      throw new IllegalStateException("Unsupported naming.domain: '" + domain + "'");
    }
    if (!redCutoffs.isEmpty()) {
      // fails fast on a malformed override
      RedCutoffs.of(redCutoffs);
      log.info("Using configured RED cutoffs {}", redCutoffs);
    }
  }

  /** Cutoffs for the domain, honouring the configured override. */
  public RedCutoffs cutoffsFor(Domain domain) {
    return redCutoffs.isEmpty() ? RedCutoffs.forDomain(domain) : RedCutoffs.of(redCutoffs);
  }

  /** Tree table parsing options. */
  @Getter
  @Setter
  public static class Tree {

    /** Tokens read as missing values, in addition to empty fields. */
    private List<String> nullValues = new ArrayList<>(List.of("NA"));
  }

  /** Column names of the genome metadata table. */
  @Getter
  @Setter
  public static class Metadata {

    private String genomeColumn = "ID";

    private String completenessColumn = "checkm2_completeness";

    private String contaminationColumn = "checkm2_contamination";
  }

  /** Output file names, relative to the output directory. */
  @Getter
  @Setter
  public static class Output {

    private String genomeTaxonomyFile = "genome_taxonomy.tsv";

    private String nodeNamesFile = "node_names.tsv";
  }
}
