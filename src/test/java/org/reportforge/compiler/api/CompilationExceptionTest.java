package org.reportforge.compiler.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CompilationExceptionTest {

    @Test
    void messageCarriesTagAndSource() {
        CompilationException located = new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                "bad", null, new SourceInfo("a.conf", 7));

        assertThat(located.getMessage()).isEqualTo("[invalid_layout_definition] bad at a.conf:7");
    }

    @Test
    void unknownSourceIsLeftOut() {
        CompilationException plain = new CompilationException(CompilerErrorCode.UNSUPPORTED_LAYOUT_TYPE, "bad");
        CompilationException unknown = new CompilationException(CompilerErrorCode.UNSUPPORTED_LAYOUT_TYPE,
                "bad", "chart", SourceInfo.UNKNOWN);

        assertThat(plain.getMessage()).isEqualTo("[unsupported_layout_type] bad");
        assertThat(unknown.getMessage()).isEqualTo("[unsupported_layout_type] bad");
        assertThat(unknown.offendingValue()).isEqualTo("chart");
    }

    @Test
    void causeIsKept() {
        IOException cause = new IOException("gone");
        CompilationException e = new CompilationException(CompilerErrorCode.IO_ERROR_READING_FILE, "cannot read", cause);

        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.IO_ERROR_READING_FILE);
        assertThat(e.sourceInfo()).isNull();
    }
}
