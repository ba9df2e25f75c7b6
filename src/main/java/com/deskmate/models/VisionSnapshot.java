package com.deskmate.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One capture published by the vision producer: recognized text plus
 * capture metadata (region, width, height) and an optional preview image path.
 */
public class VisionSnapshot {
    private final double timestamp;
    private final String text;
    private final String previewPath;
    private final Map<String, Object> meta;

    public VisionSnapshot(double timestamp, String text, String previewPath, Map<String, Object> meta) {
        this.timestamp = timestamp;
        this.text = text != null ? text : "";
        this.previewPath = previewPath;
        this.meta = meta != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(meta))
            : Collections.emptyMap();
    }

    public double getTimestamp() {
        return timestamp;
    }

    public String getText() {
        return text;
    }

    public String getPreviewPath() {
        return previewPath;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }
}
