package org.reportforge.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class IrProperties {

    private IrProperties() {}

    // Map.copyOf would lose the canonical key order.
    static Map<String, IrValue> freeze(Map<String, IrValue> properties) {
        if (properties == null || properties.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
