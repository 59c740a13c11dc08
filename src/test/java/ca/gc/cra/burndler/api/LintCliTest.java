package ca.gc.cra.burndler.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LintCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    logger = (Logger) LoggerFactory.getLogger(LintCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, LintCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Burndler compose lint"));
  }

  @Test
  void validDocumentReportsWarningsAndSucceeds() throws IOException {
    Path compose = Files.writeString(tempDir.resolve("merged.yaml"), """
        services:
          web:
            image: nginx:1.25
        """);

    ExitCode code = LintCli.run(new String[] {"in=" + compose});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("WARNING [image-digest]"), output);
    assertTrue(output.contains("valid: 0 errors, 1 warnings"), output);
  }

  @Test
  void buildDirectiveFailsTheLint() throws IOException {
    Path compose = Files.writeString(tempDir.resolve("merged.yaml"), """
        services:
          web:
            build: .
            image: nginx:1.25
        """);

    ExitCode code = LintCli.run(new String[] {"in=" + compose, "strict=false"});

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    String output = buffer.toString();
    assertTrue(output.contains("ERROR   [no-build-directive]"), output);
    assertTrue(output.contains("invalid: 1 errors"), output);
  }

  @Test
  void missingInputIsAnArgumentError() {
    ExitCode code = LintCli.run(new String[] {});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: lint"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("in is required for lint"));
    assertTrue(logged);
  }

  @Test
  void unreadableInputIsAnArgumentError() {
    ExitCode code = LintCli.run(new String[] {"in=" + tempDir.resolve("missing.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: lint"));
  }

  @Test
  void unparsableDocumentIsAConfigError() throws IOException {
    Path compose = Files.writeString(tempDir.resolve("broken.yaml"), "services: [unclosed\n");

    assertEquals(ExitCode.CONFIG_ERROR, LintCli.run(new String[] {"in=" + compose}));
  }
}
