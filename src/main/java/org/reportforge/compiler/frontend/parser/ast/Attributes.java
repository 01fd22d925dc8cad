package org.reportforge.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class Attributes {

    private Attributes() {}

    static Map<String, Object> freeze(Map<String, Object> attributes) {
        if (attributes == null || attributes.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
