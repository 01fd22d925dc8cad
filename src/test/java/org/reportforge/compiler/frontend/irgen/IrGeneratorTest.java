package org.reportforge.compiler.frontend.irgen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.api.InvalidTrackDefinitionException;
import org.reportforge.compiler.api.UnknownElementTypeException;
import org.reportforge.compiler.diagnostics.DiagnosticsEngine;
import org.reportforge.compiler.frontend.parser.LayoutDefinitionParser;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.ir.FieldFormat;
import org.reportforge.compiler.ir.IrCell;
import org.reportforge.compiler.ir.IrField;
import org.reportforge.compiler.ir.IrGrid;
import org.reportforge.compiler.ir.IrHeader;
import org.reportforge.compiler.ir.IrLabel;
import org.reportforge.compiler.ir.IrLayout;
import org.reportforge.compiler.ir.IrLine;
import org.reportforge.compiler.ir.IrNestedLayout;
import org.reportforge.compiler.ir.IrRow;
import org.reportforge.compiler.ir.IrStack;
import org.reportforge.compiler.ir.IrStyle;
import org.reportforge.compiler.ir.IrTable;
import org.reportforge.compiler.ir.IrValue;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class IrGeneratorTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private IrLayout transform(String hocon) throws CompilationException {
        LayoutNode node = new LayoutDefinitionParser(diagnostics).parseLayout(hocon, "test.conf");
        return new IrGenerator(diagnostics, IrConverterRegistry.initializeWithDefaults()).generate(node, "test");
    }

    @Test
    void tableGetsStrokeAndInsetDefaultsButGridDoesNot() throws Exception {
        IrLayout table = transform("""
            type = table
            columns = 2
            """);
        IrLayout grid = transform("""
            type = grid
            columns = 2
            """);

        assertThat(table.properties())
                .containsEntry("stroke", new IrValue.Str("1pt"))
                .containsEntry("inset", new IrValue.Str("5pt"));
        assertThat(grid.properties()).doesNotContainKeys("stroke", "inset");
    }

    @Test
    void explicitTablePropertiesWinOverDefaults() throws Exception {
        IrLayout table = transform("""
            type = table
            stroke = "0.5pt"
            inset = 2
            """);

        assertThat(table.properties())
                .containsEntry("stroke", new IrValue.Str("0.5pt"))
                .containsEntry("inset", new IrValue.Int64(2));
    }

    @Test
    void axisGutterSuppressesGeneralGutter() throws Exception {
        IrLayout grid = transform("""
            type = grid
            gutter = "4pt"
            column-gutter = "8pt"
            """);

        assertThat(grid.properties())
                .containsEntry("column-gutter", new IrValue.Str("8pt"))
                .doesNotContainKeys("gutter", "row-gutter");
    }

    @Test
    void propertiesUseCanonicalOrderAndDropNulls() throws Exception {
        IrLayout table = transform("""
            type = table
            stroke = none
            fill = null
            align = center
            rows = auto
            columns = [1, 2]
            gutter = 3
            """);

        assertThat(table.properties().keySet())
                .containsExactly("columns", "rows", "gutter", "align", "inset", "stroke");
        assertThat(table.properties().get("columns"))
                .isEqualTo(IrValue.strings(List.of("1pt", "2pt")));
    }

    @Test
    void childrenAreRowsThenLooseCellsThenBareElements() throws Exception {
        IrGrid grid = (IrGrid) transform("""
            type = grid
            elements = [ { text = "E" } ]
            cells = [ { x = 1, y = 2, colspan = 2, content = [ { text = "C" } ] } ]
            body = [
              { height = "20pt", cells = [ { content = [ { text = "R" } ] } ] }
              { cells = [] }
            ]
            """);

        assertThat(grid.children()).hasSize(4);
        IrRow first = (IrRow) grid.children().get(0);
        IrRow second = (IrRow) grid.children().get(1);
        assertEquals(0, first.index());
        assertEquals(1, second.index());
        assertThat(first.properties()).containsEntry("height", new IrValue.Str("20pt"));
        assertThat(second.cells()).isEmpty();

        IrCell loose = (IrCell) grid.children().get(2);
        assertThat(loose.x()).isEqualTo(1);
        assertThat(loose.y()).isEqualTo(2);
        assertThat(loose.colspan()).isEqualTo(2);
        assertThat(loose.rowspan()).isEqualTo(1);

        IrCell wrapped = (IrCell) grid.children().get(3);
        assertThat(wrapped).isEqualTo(IrCell.wrapping(new IrLabel("E", null)));
    }

    @Test
    void headerAndFooterMembersAreRowsOrWrappedCells() throws Exception {
        IrTable table = (IrTable) transform("""
            type = table
            headers = [
              {
                level = 2
                rows = [
                  { content = [ { text = "H" } ] }
                  { cells = [ { content = [ { text = "A" } ] }, { content = [ { text = "B" } ] } ] }
                ]
              }
            ]
            footers = [ [ { content = [ { text = "F" } ] } ] ]
            """);

        IrHeader header = table.headers().get(0);
        assertThat(header.repeat()).isTrue();
        assertThat(header.level()).isEqualTo(2);
        assertThat(header.rows()).hasSize(2);
        assertThat(header.rows().get(0).index()).isZero();
        assertThat(header.rows().get(0).cells()).hasSize(1);
        assertThat(header.rows().get(1).index()).isEqualTo(1);
        assertThat(header.rows().get(1).cells()).hasSize(2);

        assertThat(table.footers()).hasSize(1);
        assertThat(table.footers().get(0).repeat()).isFalse();
        assertThat(table.footers().get(0).rows().get(0).cells().get(0).content())
                .containsExactly(new IrLabel("F", null));
    }

    @Test
    void fieldsCarrySourceFormatAndPlaces() throws Exception {
        IrGrid grid = (IrGrid) transform("""
            type = grid
            elements = [
              { source = [customer, balance], format = currency, decimal-places = 3 }
              { source = name }
            ]
            """);

        assertThat(((IrCell) grid.children().get(0)).content())
                .containsExactly(new IrField(List.of("customer", "balance"), FieldFormat.CURRENCY, 3, null));
        assertThat(((IrCell) grid.children().get(1)).content())
                .containsExactly(new IrField(List.of("name"), null, null, null));
    }

    @Test
    void nestedStyleMapWinsOverFlatAttributes() throws Exception {
        IrGrid grid = (IrGrid) transform("""
            type = grid
            elements = [
              { text = "T", font-weight = bold, font-size = 12, style { font-weight = light, color = "#333333" } }
            ]
            """);

        IrLabel label = (IrLabel) ((IrCell) grid.children().get(0)).content().get(0);
        assertThat(label.style()).isEqualTo(new IrStyle(
                new IrValue.Int64(12), new IrValue.Str("light"), null, "#333333", null, null));
    }

    @Test
    void stackWrapsEveryElementAndNestsLayouts() throws Exception {
        IrStack stack = (IrStack) transform("""
            type = stack
            dir = ltr
            elements = [
              { text = "A" }
              { type = grid, columns = 2, elements = [ { text = "B" } ] }
            ]
            """);

        assertThat(stack.properties()).containsOnlyKeys("dir");
        assertThat(stack.children()).hasSize(2);
        assertThat(stack.children()).allSatisfy(cell -> assertThat(cell.content()).hasSize(1));
        IrNestedLayout nested = (IrNestedLayout) stack.children().get(1).content().get(0);
        assertThat(nested.layout()).isInstanceOf(IrGrid.class);
        assertThat(nested.layout().properties().get("columns"))
                .isEqualTo(IrValue.strings(List.of("auto", "auto")));
    }

    @Test
    void linesGoToTheTrailingSlot() throws Exception {
        IrGrid grid = (IrGrid) transform("""
            type = grid
            lines = [ { y = 1, stroke = "2pt" }, { x = 2, start = 0, end = 3 } ]
            """);

        assertThat(grid.lines()).containsExactly(
                new IrLine(IrLine.Orientation.HORIZONTAL, 1, null, null, new IrValue.Str("2pt")),
                new IrLine(IrLine.Orientation.VERTICAL, 2, 0, 3, null));
    }

    @Test
    void unknownElementFailsTheWholeLayout() {
        assertThatThrownBy(() -> transform("""
            type = grid
            elements = [ { text = "ok" }, { chart = "sales" } ]
            """))
                .isInstanceOfSatisfying(UnknownElementTypeException.class,
                        e -> assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_ELEMENT_TYPE));
    }

    @Test
    void itemWithUnknownTypeIsAnUnknownElement() {
        assertThatThrownBy(() -> transform("""
            type = table
            cells = [ { content = [ { type = chart } ] } ]
            """))
                .isInstanceOf(UnknownElementTypeException.class);
    }

    @Test
    void nestedFailurePropagatesToTheTopLevel() {
        assertThatThrownBy(() -> transform("""
            type = stack
            elements = [
              { type = table, elements = [ { type = grid, rows = "wide" } ] }
            ]
            """))
                .isInstanceOfSatisfying(InvalidTrackDefinitionException.class,
                        e -> assertThat(e.axis()).isEqualTo(TrackAxis.ROWS));
    }

    @Test
    void invalidSpanIsRejected() {
        assertThatThrownBy(() -> transform("""
            type = grid
            cells = [ { colspan = 0 } ]
            """))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.INVALID_LAYOUT_DEFINITION));
    }

    @Test
    void transformingTwiceYieldsEqualTrees() throws Exception {
        String hocon = """
            type = table
            columns = [{fr = 1}, 40]
            headers = [ [ { content = [ { text = "X", font-style = italic } ] } ] ]
            elements = [ { source = [a, b], format = percent } ]
            """;

        assertThat(transform(hocon)).isEqualTo(transform(hocon));
    }

    @Test
    void unknownFormatIsAWarningNotAnError() throws Exception {
        IrGrid grid = (IrGrid) transform("""
            type = grid
            elements = [ { source = amount, format = money } ]
            """);

        assertThat(((IrField) ((IrCell) grid.children().get(0)).content().get(0)).format()).isNull();
        assertThat(diagnostics.hasWarnings()).isTrue();
        assertThat(diagnostics.summary()).contains("money");
    }
}
