package com.deskmate.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A structured instruction for the character (motion, expression, transform).
 * The payload stays an open map; fields are converted where they are used.
 */
public class Directive {
    private final String kind;
    private final Map<String, Object> payload;

    public Directive(String kind, Map<String, Object> payload) {
        this.kind = kind != null ? kind : "";
        this.payload = payload != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
            : Collections.emptyMap();
    }

    public String getKind() {
        return kind;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public String normalizedKind() {
        return kind.trim().toLowerCase(Locale.ROOT);
    }

    public Object get(String key) {
        return payload.get(key);
    }

    /**
     * First non-null payload value among the given keys.
     */
    public Object first(String... keys) {
        for (String key : keys) {
            Object value = payload.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "Directive{" + kind + " " + payload + "}";
    }
}
