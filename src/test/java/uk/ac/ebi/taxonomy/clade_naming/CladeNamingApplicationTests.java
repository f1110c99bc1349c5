package uk.ac.ebi.taxonomy.clade_naming;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import uk.ac.ebi.taxonomy.clade_naming.config.NamingConfig;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MissingNodeException;
import uk.ac.ebi.taxonomy.clade_naming.model.Domain;
import uk.ac.ebi.taxonomy.clade_naming.model.Rank;

@SpringBootTest
@ActiveProfiles("test")
class CladeNamingApplicationTests {

  @Autowired private ApplicationContext context;
  @Autowired private NamingConfig namingConfig;
  @Autowired private ExitCodeExceptionMapper exitCodeExceptionMapper;

  @Test
  void contextLoads() {
    assertTrue(context.containsBean("namingRunService"));
    assertTrue(context.getBeansOfType(NamingCommandRunner.class).isEmpty());
  }

  @Test
  void testProfilePropertiesAreBound() {
    assertEquals("d__Archaea", namingConfig.getDomain());
    assertEquals(10, namingConfig.getProgressInterval());
    assertEquals("ID", namingConfig.getMetadata().getGenomeColumn());
    assertEquals(
        0.9069458981600348, namingConfig.cutoffsFor(Domain.ARCHAEA).median(Rank.GENUS));
  }

  @Test
  void exitCodesFollowTheCauseChain() {
    assertEquals(2, exitCodeExceptionMapper.getExitCode(new MissingNodeException(5)));
    assertEquals(
        2,
        exitCodeExceptionMapper.getExitCode(
            new IllegalStateException("runner failed", new MissingNodeException(5))));
    assertEquals(
        64, exitCodeExceptionMapper.getExitCode(new IllegalArgumentException("--tree-df")));
    assertEquals(
        1,
        exitCodeExceptionMapper.getExitCode(
            new UncheckedIOException(new IOException("disk full"))));
  }
}
