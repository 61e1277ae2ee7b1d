package com.hemovita.model.reference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical many-to-one mapping from lab markers and network nodes to the
 * supplement key that gets scheduled. Names without an alias map to themselves.
 */
public final class AliasTable {

    private final Map<String, String> aliases;

    public AliasTable(Map<String, String> aliases) {
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public static AliasTable identity() {
        return new AliasTable(Map.of());
    }

    public String keyFor(String name) {
        if (name == null) {
            return "";
        }
        String trimmed = name.trim();
        return aliases.getOrDefault(trimmed, trimmed);
    }

    public Map<String, String> asMap() {
        return aliases;
    }
}
