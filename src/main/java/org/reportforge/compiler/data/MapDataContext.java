package org.reportforge.compiler.data;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A {@link DataContext} backed by nested {@link Map}s, as produced by JSON or HOCON readers.
 */
public final class MapDataContext implements DataContext {

    private static final MapDataContext EMPTY = new MapDataContext(Collections.emptyMap());

    private final Map<String, ?> root;

    /**
     * @param root The top-level record. Never null.
     */
    public MapDataContext(Map<String, ?> root) {
        this.root = root;
    }

    /**
     * @return A context in which every lookup fails with {@link LookupResult.NotFound}.
     */
    public static MapDataContext empty() {
        return EMPTY;
    }

    @Override
    public LookupResult lookup(List<String> path) {
        Object current = root;
        for (String key : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return new LookupResult.WrongContainer(key, current);
            }
            if (!map.containsKey(key)) {
                return new LookupResult.NotFound(key);
            }
            current = map.get(key);
        }
        return new LookupResult.Found(current);
    }
}
