package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.api.FieldMode;
import org.reportforge.compiler.api.RenderOptions;
import org.reportforge.compiler.data.LookupResult;

import java.util.List;

/**
 * Per-pass state shared by the emitters: the data context, the field mode and
 * the indentation unit. Immutable, so one instance may serve concurrent passes.
 */
public final class EmissionContext {

    static final String INDENT = "  ";

    private final RenderOptions options;

    /**
     * @param options The options of this rendering pass.
     */
    public EmissionContext(RenderOptions options) {
        this.options = options;
    }

    public boolean references() {
        return options.fieldMode() == FieldMode.REFERENCES;
    }

    /**
     * @param path The key path of a field.
     * @return The resolved value, or null for every kind of absence.
     */
    public Object resolve(List<String> path) {
        LookupResult result = options.data().lookup(path);
        return result == null ? null : result.valueOrNull();
    }

    /**
     * @param level The nesting level.
     * @return The indentation of that level.
     */
    public static String indent(int level) {
        return INDENT.repeat(Math.max(0, level));
    }
}
