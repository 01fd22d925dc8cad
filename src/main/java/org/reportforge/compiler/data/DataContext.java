package org.reportforge.compiler.data;

import java.util.List;

/**
 * Contract of the record-like context that data-bound fields are resolved against.
 * Implementations must be safe to share between threads once constructed.
 */
public interface DataContext {

    /**
     * Resolves a field source. A single-key path is a direct lookup; longer paths are
     * resolved left to right, each step looking into the result of the previous one.
     *
     * @param path The keys to follow, never empty.
     * @return The lookup outcome, never null.
     */
    LookupResult lookup(List<String> path);
}
