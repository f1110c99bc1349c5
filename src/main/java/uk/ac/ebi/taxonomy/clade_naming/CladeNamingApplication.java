package uk.ac.ebi.taxonomy.clade_naming;

import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.NamingException;

@SpringBootApplication
public class CladeNamingApplication {

  static final int EXIT_INVALID_INPUT = 2;
  static final int EXIT_USAGE = 64;

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(CladeNamingApplication.class, args)));
  }

  /** Maps failures to exit codes: 2 for invalid input, 64 for bad options, 1 otherwise. */
  @Bean
  public ExitCodeExceptionMapper exitCodeExceptionMapper() {
    return exception -> {
      for (Throwable cause = exception; cause != null; cause = cause.getCause()) {
        if (cause instanceof NamingException) {
          return EXIT_INVALID_INPUT;
        }
        if (cause instanceof IllegalArgumentException) {
          return EXIT_USAGE;
        }
      }
      return 1;
    };
  }
}
