package org.reportforge.compiler.api;

import org.reportforge.compiler.data.DataContext;
import org.reportforge.compiler.data.MapDataContext;

import java.util.Map;
import java.util.Objects;

/**
 * Options for a single rendering pass.
 *
 * @param data The data context fields are resolved against. Never null.
 * @param fieldMode Whether fields render as values or as runtime references.
 */
public record RenderOptions(DataContext data, FieldMode fieldMode) {

    public RenderOptions {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(fieldMode, "fieldMode");
    }

    /**
     * @param data The record fields are resolved against.
     * @return Options interpolating field values from the given data.
     */
    public static RenderOptions values(DataContext data) {
        return new RenderOptions(data, FieldMode.VALUES);
    }

    /**
     * @param record The record fields are resolved against, as nested maps.
     * @return Options interpolating field values from the given record.
     */
    public static RenderOptions values(Map<String, ?> record) {
        return values(new MapDataContext(record));
    }

    /**
     * @return Options emitting runtime field references instead of values.
     */
    public static RenderOptions references() {
        return new RenderOptions(MapDataContext.empty(), FieldMode.REFERENCES);
    }
}
