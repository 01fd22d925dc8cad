package org.reportforge.compiler.ir;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small, typed value system used for layout and cell properties. Keeps raw
 * configuration objects out of the IR.
 */
public sealed interface IrValue permits IrValue.Int64, IrValue.Decimal, IrValue.Str, IrValue.Bool, IrValue.ListVal, IrValue.MapVal {
    /**
     * Represents a 64-bit integer value.
     * @param value The long value.
     */
    record Int64(long value) implements IrValue {}

    /**
     * Represents a decimal value.
     * @param value The decimal value.
     */
    record Decimal(BigDecimal value) implements IrValue {}

    /**
     * Represents a string value.
     * @param value The string value.
     */
    record Str(String value) implements IrValue {}

    /**
     * Represents a boolean value.
     * @param value The boolean value.
     */
    record Bool(boolean value) implements IrValue {}

    /**
     * Represents a list of IrValue elements.
     * @param elements The list of IrValue elements.
     */
    record ListVal(List<IrValue> elements) implements IrValue {
        public ListVal {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Represents an ordered map of string keys to IrValue values.
     * @param entries The map of string keys to IrValue values.
     */
    record MapVal(Map<String, IrValue> entries) implements IrValue {
        public MapVal {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    /**
     * Converts a value as produced by Typesafe Config's {@code unwrapped()} or a JSON reader.
     *
     * @param raw The raw value. Can be null.
     * @return The typed value, or null if {@code raw} is null.
     * @throws IllegalArgumentException if the value has no IR counterpart.
     */
    static IrValue of(Object raw) {
        if (raw == null) return null;
        if (raw instanceof IrValue v) return v;
        if (raw instanceof String s) return new Str(s);
        if (raw instanceof Boolean b) return new Bool(b);
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return new Int64(((Number) raw).longValue());
        }
        if (raw instanceof BigDecimal d) return new Decimal(d);
        if (raw instanceof Number n) return new Decimal(new BigDecimal(n.toString()));
        if (raw instanceof List<?> list) {
            List<IrValue> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                IrValue converted = of(element);
                if (converted != null) elements.add(converted);
            }
            return new ListVal(elements);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, IrValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                IrValue converted = of(e.getValue());
                if (converted != null) entries.put(String.valueOf(e.getKey()), converted);
            }
            return new MapVal(entries);
        }
        throw new IllegalArgumentException("Unsupported property value type: " + raw.getClass().getName());
    }

    /**
     * @param values The strings to wrap.
     * @return A list value of {@link Str} elements.
     */
    static ListVal strings(List<String> values) {
        List<IrValue> elements = new ArrayList<>(values.size());
        for (String value : values) elements.add(new Str(value));
        return new ListVal(elements);
    }
}
