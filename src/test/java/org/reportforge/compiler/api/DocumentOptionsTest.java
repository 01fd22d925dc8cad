package org.reportforge.compiler.api;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DocumentOptionsTest {

    @Test
    void readsRendererSection() {
        DocumentOptions options = DocumentOptions.fromConfig(ConfigFactory.parseString("""
            renderer {
              page-size = a4
              margin = "2cm"
              font = "Inter"
              font-size = 10
            }
            """));

        assertThat(options).isEqualTo(new DocumentOptions("a4", "2cm", "Inter", "10pt"));
    }

    @Test
    void numericLengthsArePoints() {
        DocumentOptions options = DocumentOptions.fromConfig(ConfigFactory.parseString("renderer { margin = 36.0 }"));

        assertThat(options.margin()).isEqualTo("36pt");
        assertThat(options.pageSize()).isNull();
    }

    @Test
    void missingSectionMeansNoDirectives() {
        assertThat(DocumentOptions.fromConfig(ConfigFactory.empty())).isEqualTo(DocumentOptions.none());
    }

    @Test
    void referenceConfigSetsNoDocumentDefaults() {
        assertThat(DocumentOptions.fromConfig(ConfigFactory.load())).isEqualTo(DocumentOptions.none());
    }

    @Test
    void withersReplaceOneOption() {
        DocumentOptions options = DocumentOptions.none().withPageSize("us-letter").withFontSize("11pt");

        assertThat(options).isEqualTo(new DocumentOptions("us-letter", null, null, "11pt"));
    }
}
