package com.deskmate.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ParameterTarget {
    private final String id;
    private final double value;

    public ParameterTarget(String id, double value) {
        this.id = id;
        this.value = value;
    }

    public String getId() {
        return id;
    }

    public double getValue() {
        return value;
    }

    /**
     * Keeps only entries with a string id and a numeric value, in map order.
     */
    public static List<ParameterTarget> fromMap(Map<?, ?> raw) {
        List<ParameterTarget> targets = new ArrayList<>();
        if (raw == null) {
            return targets;
        }
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String)) continue;
            Object value = entry.getValue();
            if (value instanceof Number) {
                targets.add(new ParameterTarget((String) entry.getKey(), ((Number) value).doubleValue()));
            }
        }
        return targets;
    }
}
