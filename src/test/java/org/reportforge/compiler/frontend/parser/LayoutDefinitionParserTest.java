package org.reportforge.compiler.frontend.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.diagnostics.Diagnostic;
import org.reportforge.compiler.diagnostics.DiagnosticsEngine;
import org.reportforge.compiler.frontend.parser.ast.CellNode;
import org.reportforge.compiler.frontend.parser.ast.ItemNode;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.frontend.parser.ast.ReportNode;
import org.reportforge.compiler.frontend.parser.ast.RowNode;
import org.reportforge.compiler.frontend.parser.ast.SectionNode;
import org.reportforge.compiler.ir.LayoutKind;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LayoutDefinitionParserTest {

    private DiagnosticsEngine diagnostics;
    private LayoutDefinitionParser parser;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        parser = new LayoutDefinitionParser(diagnostics);
    }

    @Test
    void parsesReportWithNameAndLayouts() throws Exception {
        ReportNode report = parser.parseReport("""
            report {
              name = sales
              layouts = [
                { type = grid, columns = 2 }
                { type = stack, dir = ttb }
              ]
            }
            """, "test.conf");

        assertThat(report.name()).isEqualTo("sales");
        assertThat(report.layouts()).extracting(LayoutNode::kind)
                .containsExactly(LayoutKind.GRID, LayoutKind.STACK);
        assertThat(report.layouts().get(0).attribute("columns")).isEqualTo(2);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void reportNameDefaultsToFileBaseName() throws Exception {
        ReportNode report = parser.parseReport("layouts = [ { type = table } ]", "dir/invoice.conf");

        assertThat(report.name()).isEqualTo("invoice");
        assertThat(report.layouts()).hasSize(1);
    }

    @Test
    void unsupportedTypeIsRejectedWithItsSource() {
        assertThatThrownBy(() -> parser.parseReport("""
            report {
              name = sales
              layouts = [
                {
                  type = chart
                }
              ]
            }
            """, "test.conf"))
                .isInstanceOfSatisfying(CompilationException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_LAYOUT_TYPE);
                    assertThat(e.offendingValue()).isEqualTo("chart");
                    assertThat(e.sourceInfo().fileName()).isEqualTo("test.conf");
                    assertThat(e.getMessage()).startsWith("[unsupported_layout_type]").contains("chart");
                });
    }

    @Test
    void missingTypeIsUnsupported() {
        assertThatThrownBy(() -> parser.parseLayout("columns = 2", "test.conf"))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_LAYOUT_TYPE));
    }

    @Test
    void structuralMismatchIsInvalidDefinition() {
        assertThatThrownBy(() -> parser.parseLayout("""
            type = grid
            body = "rows"
            """, "test.conf"))
                .isInstanceOfSatisfying(CompilationException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.INVALID_LAYOUT_DEFINITION);
                    assertThat(e.getMessage()).contains("Expected body to be a list");
                });
    }

    @Test
    void reportWithoutLayoutsIsInvalid() {
        assertThatThrownBy(() -> parser.parseReport("report { name = x }", "test.conf"))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.INVALID_LAYOUT_DEFINITION));
    }

    @Test
    void syntaxErrorsKeepTheirCause() {
        assertThatThrownBy(() -> parser.parseLayout("type = grid\ncolumns = [", "test.conf"))
                .isInstanceOfSatisfying(CompilationException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.INVALID_LAYOUT_DEFINITION);
                    assertThat(e.getCause()).isNotNull();
                });
    }

    @Test
    void unknownKeysAreWarnings() throws Exception {
        parser.parseLayout("""
            type = grid
            colour = red
            """, "test.conf");

        assertThat(diagnostics.hasWarnings()).isTrue();
        Diagnostic warning = diagnostics.getDiagnostics().get(0);
        assertThat(warning.type()).isEqualTo(Diagnostic.Type.WARNING);
        assertThat(warning.message()).contains("colour");
        assertThat(warning.source().fileName()).isEqualTo("test.conf");
        assertThat(warning.source().lineNumber()).isEqualTo(2);
    }

    @Test
    void itemWithLayoutTypeBecomesNestedLayout() throws Exception {
        LayoutNode stack = parser.parseLayout("""
            type = stack
            elements = [
              { text = "Title", font-weight = bold }
              { type = table, columns = 3 }
            ]
            """, "test.conf");

        List<ItemNode> elements = stack.elements();
        assertThat(elements.get(0).layout()).isNull();
        assertThat(elements.get(0).attribute("font-weight")).isEqualTo("bold");
        assertThat(elements.get(1).layout()).isNotNull();
        assertThat(elements.get(1).layout().kind()).isEqualTo(LayoutKind.TABLE);
        assertThat(elements.get(1).layout().attribute("columns")).isEqualTo(3);
    }

    @Test
    void sectionsAcceptObjectAndListForms() throws Exception {
        LayoutNode table = parser.parseLayout("""
            type = table
            headers = [
              { repeat = false, level = 2, rows = [ { cells = [ { content = [ { text = "A" } ] } ] } ] }
            ]
            footers = [
              [ { colspan = 2, content = [ { text = "Total" } ] } ]
            ]
            """, "test.conf");

        SectionNode header = table.headers().get(0);
        assertThat(header.repeat()).isFalse();
        assertThat(header.level()).isEqualTo(2);
        assertThat(header.members().get(0)).isInstanceOf(RowNode.class);

        SectionNode footer = table.footers().get(0);
        assertThat(footer.repeat()).isNull();
        assertThat(footer.members().get(0)).isInstanceOfSatisfying(CellNode.class,
                cell -> assertThat(cell.colspan()).isEqualTo(2));
    }

    @Test
    void lineNeedsExactlyOneAxis() {
        assertThatThrownBy(() -> parser.parseLayout("""
            type = grid
            lines = [ { x = 1, y = 1 } ]
            """, "test.conf"))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.INVALID_LAYOUT_DEFINITION));
    }

    @Test
    void nestedMapsKeepTheirStructure() throws Exception {
        LayoutNode grid = parser.parseLayout("""
            type = grid
            columns = [ { fr = 2 }, 40 ]
            """, "test.conf");

        assertThat(grid.attribute("columns")).isEqualTo(List.of(Map.of("fr", 2), 40));
    }
}
