package org.reportforge.compiler.backend.emit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.DocumentOptions;
import org.reportforge.compiler.api.RenderOptions;
import org.reportforge.compiler.data.DataContext;
import org.reportforge.compiler.data.LookupResult;
import org.reportforge.compiler.diagnostics.DiagnosticsEngine;
import org.reportforge.compiler.frontend.irgen.IrConverterRegistry;
import org.reportforge.compiler.frontend.irgen.IrGenerator;
import org.reportforge.compiler.frontend.parser.LayoutDefinitionParser;
import org.reportforge.compiler.ir.IrLayout;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
class TypstEmitterTest {

    private final TypstEmitter emitter = new TypstEmitter();

    private static IrLayout ir(String hocon) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        return new IrGenerator(diagnostics, IrConverterRegistry.initializeWithDefaults())
                .generate(new LayoutDefinitionParser(diagnostics).parseLayout(hocon, "test.conf"), "test");
    }

    private String render(String hocon, RenderOptions options) throws CompilationException {
        return emitter.render(ir(hocon), options);
    }

    private String render(String hocon) throws CompilationException {
        return render(hocon, RenderOptions.values(Map.of()));
    }

    @Test
    void rendersGridWithTracksAndGutter() throws Exception {
        String out = render("""
            type = grid
            columns = 2
            gutter = "4pt"
            elements = [ { text = A }, { text = B } ]
            """);

        assertThat(out).isEqualTo("#grid(\n  columns: (auto, auto),\n  gutter: 4pt,\n  [A],\n  [B],\n)");
    }

    @Test
    void axisGutterReplacesGeneralGutter() throws Exception {
        String out = render("""
            type = grid
            gutter = "4pt"
            row-gutter = "2pt"
            """);

        assertThat(out).contains("\n  row-gutter: 2pt,").doesNotContain("\n  gutter:");
    }

    @Test
    void emptyContainersOnlyOpenAndClose() throws Exception {
        assertThat(render("type = stack")).isEqualTo("#stack(\n)");
        assertThat(render("type = grid")).isEqualTo("#grid(\n)");
        assertThat(render("type = table")).isEqualTo("#table(\n  inset: 5pt,\n  stroke: 1pt,\n)");
    }

    @Test
    void nestedLayoutOpensInsideItsCell() throws Exception {
        String out = render("""
            type = stack
            spacing = 6
            elements = [
              { text = "Head", font-size = 14 }
              { type = grid, columns = [{fr = 1}, 2], elements = [ { text = "L" }, { text = "R" } ] }
            ]
            """);

        assertThat(out).isEqualTo("""
            #stack(
              spacing: 6pt,
              [#text(size: 14pt)[Head]],
              [#grid(
                columns: (1fr, 2pt),
                [L],
                [R],
              )],
            )""");
    }

    @Test
    void tableSectionsWrapTheBodyAndLinesComeLast() throws Exception {
        String out = render("""
            type = table
            columns = 2
            stroke = none
            lines = [ { x = 1, start = 1 } ]
            headers = [ { level = 2, rows = [ { content = [ { text = "H" } ] } ] } ]
            footers = [ { repeat = true, rows = [ { content = [ { text = "F" } ] } ] } ]
            elements = [ { text = "B" } ]
            """);

        assertThat(out).isEqualTo("""
            #table(
              columns: (auto, auto),
              inset: 5pt,
              stroke: none,
              table.header(
                repeat: true,
                level: 2,
                [H],
              ),
              [B],
              table.footer(
                repeat: true,
                [F],
              ),
              table.vline(x: 1, start: 1),
            )""");
    }

    @Test
    void rowsAreFlattenedIntoTheirCells() throws Exception {
        String out = render("""
            type = grid
            body = [
              { height = "20pt", cells = [ { content = [ { text = "1" } ] }, { content = [ { text = "2" } ] } ] }
            ]
            """);

        assertThat(out).isEqualTo("#grid(\n  [1],\n  [2],\n)");
    }

    @Test
    void cellParametersAreRendered() throws Exception {
        String grid = render("""
            type = grid
            cells = [ { colspan = 2, fill = "#ff0000", content = [ { text = X } ] } ]
            """);
        String table = render("""
            type = table
            cells = [
              { rowspan = 3, breakable = false, content = [ { text = Y }, { text = Z } ] }
              { breakable = true, content = [] }
            ]
            """);

        assertThat(grid).contains("\n  grid.cell(colspan: 2, fill: rgb(\"#ff0000\"))[X],\n");
        assertThat(table).contains("\n  table.cell(rowspan: 3, breakable: false)[Y Z],\n");
        assertThat(table).contains("\n  [],\n");
    }

    @Test
    void fieldsResolveNestedPaths() throws Exception {
        String out = render("""
            type = grid
            elements = [ { source = [a, b] }, { source = [a, c], format = currency } ]
            """, RenderOptions.values(Map.of("a", Map.of("b", "hello", "c", 2))));

        assertThat(out).contains("\n  [hello],\n").contains("\n  [\\$2.00],\n");
    }

    @Test
    void missingDataRendersEmpty() throws Exception {
        DataContext data = mock(DataContext.class);
        when(data.lookup(anyList())).thenReturn(new LookupResult.NotFound("total"));

        String out = render("""
            type = grid
            elements = [ { source = total, format = currency } ]
            """, RenderOptions.values(data));

        assertThat(out).isEqualTo("#grid(\n  [],\n)");
        verify(data).lookup(List.of("total"));
    }

    @Test
    void referenceModeEmitsRuntimeExpressions() throws Exception {
        String out = render("""
            type = grid
            elements = [
              { text = "No. [number]" }
              { source = [customer, name], font-weight = bold }
            ]
            """, RenderOptions.references());

        assertThat(out).isEqualTo("""
            #grid(
              [No. #data.variables.number],
              [#text(weight: "bold")[#record.customer.name]],
            )""");
    }

    @Test
    void renderingIsRepeatable() throws Exception {
        IrLayout layout = ir("""
            type = table
            columns = [{fr = 3}, 60]
            elements = [ { source = x, format = percent } ]
            """);
        RenderOptions options = RenderOptions.values(Map.of("x", 0.5));

        assertThat(emitter.render(layout, options)).isEqualTo(emitter.render(layout, options));
        assertThat(emitter.render(layout, options)).contains("[50.0%]");
    }

    @Test
    void reportStartsWithPreambleAndSeparatesLayouts() throws Exception {
        List<IrLayout> layouts = List.of(ir("type = grid"), ir("type = stack"));
        DocumentOptions document = new DocumentOptions("a4", "2cm", "Inter", "10pt");

        assertThat(emitter.renderReport(layouts, RenderOptions.values(Map.of()), document)).isEqualTo("""
            #set page(paper: "a4")
            #set page(margin: 2cm)
            #set text(font: "Inter")
            #set text(size: 10pt)

            #grid(
            )

            #stack(
            )""");
        assertThat(emitter.renderReport(layouts, RenderOptions.values(Map.of()), DocumentOptions.none()))
                .isEqualTo("#grid(\n)\n\n#stack(\n)");
    }
}
