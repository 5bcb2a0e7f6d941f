package com.ifblock.variable;

import com.ifblock.value.Value;

import java.util.Optional;

/**
 * Read-only view of the merged variable store used by condition expressions.
 * Lookups are case-insensitive and accept dot-separated paths (e.g. "USER.NAME").
 */
public interface VariableAccessor {

    /**
     * Resolve a variable path.
     *
     * @param path Variable path, simple or dot-separated
     * @return Resolved value, or empty if the path does not resolve
     */
    Optional<Value> tryGet(String path);

    /**
     * Check whether a path resolves. Never fails.
     */
    default boolean contains(String path) {
        return tryGet(path).isPresent();
    }

    /**
     * An accessor that resolves nothing.
     */
    static VariableAccessor empty() {
        return path -> Optional.empty();
    }
}
