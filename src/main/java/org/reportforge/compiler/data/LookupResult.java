package org.reportforge.compiler.data;

/**
 * Outcome of resolving a field source against a data context. Absences are typed
 * so callers can tell them apart, but the renderer treats every absence like a
 * present {@code null} value.
 */
public sealed interface LookupResult permits LookupResult.Found, LookupResult.NotFound, LookupResult.WrongContainer {

    /**
     * A value was found at the path. The value itself may still be null.
     * @param value The resolved value.
     */
    record Found(Object value) implements LookupResult {}

    /**
     * A key on the path does not exist in its container.
     * @param key The missing key.
     */
    record NotFound(String key) implements LookupResult {}

    /**
     * An intermediate step of the path resolved to something that cannot be looked into.
     * @param key The key that was to be looked up.
     * @param actual The value found in place of a container.
     */
    record WrongContainer(String key, Object actual) implements LookupResult {}

    /**
     * @return The resolved value, or null for every kind of absence.
     */
    default Object valueOrNull() {
        return this instanceof Found found ? found.value() : null;
    }
}
