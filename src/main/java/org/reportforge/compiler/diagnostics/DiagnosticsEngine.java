package org.reportforge.compiler.diagnostics;

import org.reportforge.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects non-fatal diagnostics (unknown keys, ignored attributes) that occur
 * while a layout definition is loaded. Errors are never collected here: they
 * abort the compilation with a {@link org.reportforge.compiler.api.CompilationException}.
 * <p>
 * Not thread-safe; use one instance per compilation.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param source  Where the warning occurred.
     */
    public void reportWarning(String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, source));
    }

    /**
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
