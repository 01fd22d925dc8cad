package org.reportforge.compiler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.reportforge.compiler.diagnostics.CompilerLogger;
import org.reportforge.compiler.frontend.parser.ast.ReportNode;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LayoutCompilerDiagnosticsTest {

    private static final String REPORT = """
            report {
              name = warnings
              layouts = [
                {
                  type = stack
                  colour = red
                  elements = [
                    { source = amount, format = bogus }
                    { text = "Total", style = bold }
                  ]
                }
              ]
            }
            """;

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private LayoutCompiler compiler;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(CompilerLogger.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        compiler = new LayoutCompiler();
        compiler.setVerbosity(CompilerLogger.WARN);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        CompilerLogger.setLevel(CompilerLogger.INFO);
    }

    private List<String> warnings() {
        return appender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Test
    void warningsFromIrGenerationAreLogged() throws Exception {
        ReportNode report = compiler.parse(REPORT, "warnings.conf");
        compiler.transform(report);

        assertThat(compiler.getDiagnostics().hasWarnings()).isTrue();
        assertThat(warnings())
                .anyMatch(m -> m.contains("Unknown field format 'bogus'"))
                .anyMatch(m -> m.contains("Ignoring 'style' that is not a map: bold"));
    }

    @Test
    void eachDiagnosticIsLoggedOnce() throws Exception {
        ReportNode report = compiler.parse(REPORT, "warnings.conf");
        assertThat(warnings()).hasSize(1).allMatch(m -> m.contains("Unknown key 'colour'"));

        compiler.transform(report.layouts().get(0));

        assertThat(warnings()).hasSize(3);
        assertThat(warnings()).hasSameSizeAs(compiler.getDiagnostics().getDiagnostics());
    }

    @Test
    void quietVerbosityLogsNothing() throws Exception {
        compiler.setVerbosity(CompilerLogger.ERROR);

        compiler.transform(compiler.parse(REPORT, "warnings.conf"));

        assertThat(compiler.getDiagnostics().getDiagnostics()).hasSize(3);
        assertThat(warnings()).isEmpty();
    }
}
