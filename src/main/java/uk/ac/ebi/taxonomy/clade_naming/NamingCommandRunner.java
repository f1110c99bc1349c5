package uk.ac.ebi.taxonomy.clade_naming;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import uk.ac.ebi.taxonomy.clade_naming.config.NamingConfig;
import uk.ac.ebi.taxonomy.clade_naming.model.Domain;
import uk.ac.ebi.taxonomy.clade_naming.model.NamingRequest;
import uk.ac.ebi.taxonomy.clade_naming.model.RedCutoffs;

/**
 * Command-line entry point.
 *
 * <p>Options: {@code --tree-df}, {@code --metadata}, {@code --gtdb} and {@code --output} are
 * required; {@code --domain} and {@code --red-cutoffs} override the configured defaults;
 * {@code --debug} and {@code --quiet} change the log level.
 */
@Slf4j
@Component
@Profile("!test")
public class NamingCommandRunner implements ApplicationRunner {

  static final String TREE_OPTION = "tree-df";
  static final String METADATA_OPTION = "metadata";
  static final String REFERENCE_OPTION = "gtdb";
  static final String DOMAIN_OPTION = "domain";
  static final String CUTOFFS_OPTION = "red-cutoffs";
  static final String OUTPUT_OPTION = "output";
  static final String DEBUG_OPTION = "debug";
  static final String QUIET_OPTION = "quiet";

  private static final String LOGGER_ROOT = "uk.ac.ebi.taxonomy.clade_naming";

  private final NamingRunService runService;
  private final NamingConfig namingConfig;
  private final LoggingSystem loggingSystem;

  public NamingCommandRunner(
      NamingRunService runService, NamingConfig namingConfig, LoggingSystem loggingSystem) {
    this.runService = runService;
    this.namingConfig = namingConfig;
    this.loggingSystem = loggingSystem;
  }

  @Override
  public void run(ApplicationArguments args) {
    applyLogLevel(args);
    NamingRequest request = toRequest(args);
    log.debug("Running with {}", request);
    runService.run(request);
  }

  private void applyLogLevel(ApplicationArguments args) {
    if (args.containsOption(DEBUG_OPTION)) {
      loggingSystem.setLogLevel(LOGGER_ROOT, LogLevel.DEBUG);
    } else if (args.containsOption(QUIET_OPTION)) {
      loggingSystem.setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, LogLevel.ERROR);
      loggingSystem.setLogLevel(LOGGER_ROOT, LogLevel.ERROR);
    }
  }

  /**
   * Builds the run request from the options.
   *
   * @throws IllegalArgumentException if a required option is missing or a value is invalid
   */
  NamingRequest toRequest(ApplicationArguments args) {
    String domainToken = optional(args, DOMAIN_OPTION, namingConfig.getDomain());
    Domain domain = Domain.fromName(domainToken);
    if (domain == null) {
      throw new IllegalArgumentException("Unsupported domain: '" + domainToken + "'");
    }

    List<Double> cutoffValues = cutoffValues(args);
    RedCutoffs cutoffs =
        cutoffValues.isEmpty() ? namingConfig.cutoffsFor(domain) : RedCutoffs.of(cutoffValues);

    return NamingRequest.builder()
        .treeTable(requiredPath(args, TREE_OPTION))
        .metadata(requiredPath(args, METADATA_OPTION))
        .referenceTaxonomy(requiredPath(args, REFERENCE_OPTION))
        .outputDirectory(requiredPath(args, OUTPUT_OPTION))
        .domain(domain)
        .cutoffs(cutoffs)
        .build();
  }

  // accepts --red-cutoffs=a,b,c,d,e, repeated options and --red-cutoffs a b c d e
  private static List<Double> cutoffValues(ApplicationArguments args) {
    List<Double> values = new ArrayList<>();
    if (!args.containsOption(CUTOFFS_OPTION)) {
      return values;
    }
    // a bare --red-cutoffs leaves the numbers that follow it as non-option arguments
    List<String> raw = new ArrayList<>(args.getOptionValues(CUTOFFS_OPTION));
    raw.addAll(args.getNonOptionArgs());
    for (String option : raw) {
      for (String token : option.trim().split("[,\\s]+")) {
        if (!token.isEmpty()) {
          values.add(Double.valueOf(token));
        }
      }
    }
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Option --" + CUTOFFS_OPTION + " needs five values");
    }
    return values;
  }

  private static Path requiredPath(ApplicationArguments args, String option) {
    List<String> values = args.getOptionValues(option);
    if (values == null || values.isEmpty() || values.get(0).isBlank()) {
      throw new IllegalArgumentException("Missing required option --" + option);
    }
    return Path.of(values.get(0));
  }

  private static String optional(ApplicationArguments args, String option, String fallback) {
    List<String> values = args.getOptionValues(option);
    return values == null || values.isEmpty() ? fallback : values.get(0);
  }
}
