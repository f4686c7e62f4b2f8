package me.christianrobert.closureconv.transformer.closure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renames a synthesis added to the enclosing scope, in insertion order.
 */
public class RenameTableDelta {

    public static final RenameTableDelta EMPTY = new RenameTableDelta(Collections.emptyMap());

    private final Map<String, String> entries;

    public RenameTableDelta(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static RenameTableDelta of(String sourceName, String identifier) {
        return new RenameTableDelta(Collections.singletonMap(sourceName, identifier));
    }

    public Map<String, String> getEntries() {
        return entries;
    }

    public String get(String sourceName) {
        return entries.get(sourceName);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "RenameTableDelta" + entries;
    }
}
