package org.reportforge.compiler.backend.emit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.reportforge.compiler.ir.IrStyle;
import org.reportforge.compiler.ir.IrValue;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TypstStyleResolverTest {

    private static IrStyle weight(Object weight) {
        return new IrStyle(null, IrValue.of(weight), null, null, null, null);
    }

    @Test
    void noStyleRendersNothing() {
        assertThat(TypstStyleResolver.render(null)).isEmpty();
        assertThat(TypstStyleResolver.render(new IrStyle(null, null, null, null, null, null))).isEmpty();
        assertThat(TypstStyleResolver.apply(null, "x")).isEqualTo("x");
    }

    @Test
    void parametersFollowFixedOrder() {
        IrStyle style = new IrStyle(new IrValue.Int64(12), new IrValue.Str("bold"), "italic",
                "#336699", "Inter", null);

        assertThat(TypstStyleResolver.parameters(style)).containsExactly(
                "size: 12pt",
                "weight: \"bold\"",
                "style: \"italic\"",
                "fill: rgb(\"#336699\")",
                "font: \"Inter\"");
    }

    @Test
    void weightVocabularyIsMapped() {
        assertThat(TypstStyleResolver.render(weight("normal"))).isEqualTo("weight: \"regular\"");
        assertThat(TypstStyleResolver.render(weight("SemiBold"))).isEqualTo("weight: \"semibold\"");
        assertThat(TypstStyleResolver.render(weight(700))).isEqualTo("weight: 700");
        assertThat(TypstStyleResolver.render(weight("heavy"))).isEqualTo("weight: \"heavy\"");
    }

    @Test
    void normalSlantIsOmitted() {
        IrStyle style = new IrStyle(null, null, "normal", "red", null, null);

        assertThat(TypstStyleResolver.render(style)).isEqualTo("fill: red");
    }

    @Test
    void textAlignWrapsTheStyledContent() {
        IrStyle style = new IrStyle(new IrValue.Str("9pt"), null, null, null, null, new IrValue.Str("right"));
        IrStyle alignOnly = new IrStyle(null, null, null, null, null, IrValue.of(List.of("center", "horizon")));

        assertThat(TypstStyleResolver.apply(style, "Total")).isEqualTo("#align(right)[#text(size: 9pt)[Total]]");
        assertThat(TypstStyleResolver.apply(alignOnly, "X")).isEqualTo("#align(center + horizon)[X]");
    }
}
