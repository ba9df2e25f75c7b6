package com.deskmate.live2d;

import com.deskmate.AppLogger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process stand-in for a native Cubism binding, used when no renderer is configured.
 * Method names follow the binding so the same capability probing applies to it.
 */
public class HeadlessModel {

    private static final String COMPONENT = "HeadlessModel";

    private final Map<String, Float> parameters = new ConcurrentHashMap<>();
    private final Map<String, float[]> hitAreas = new ConcurrentHashMap<>();
    private final AtomicLong frames = new AtomicLong();
    private volatile String manifest;
    private volatile String lastMotion;
    private volatile float lookX;
    private volatile float lookY;
    private volatile boolean released;

    public void LoadModelJson(String path) {
        this.manifest = path;
        AppLogger.info(COMPONENT, "Loaded model manifest " + path);
    }

    public void SetParameterValue(String id, float value, float weight) {
        float current = parameters.getOrDefault(id, 0f);
        float clampedWeight = Math.max(0f, Math.min(1f, weight));
        parameters.put(id, current + (value - current) * clampedWeight);
    }

    public float GetParameterValue(String id) {
        return parameters.getOrDefault(id, 0f);
    }

    public void AddParameterValue(String id, float delta) {
        parameters.merge(id, delta, Float::sum);
    }

    public void StartMotion(String group, int index, int priority) {
        lastMotion = group + "[" + index + "]";
        AppLogger.info(COMPONENT, "Motion " + lastMotion + " (priority " + priority + ")");
    }

    public void Drag(float x, float y) {
        lookX = x;
        lookY = y;
    }

    public void SetPosition(float x, float y) {
    }

    public void SetScale(float sx, float sy) {
    }

    public void Update() {
        frames.incrementAndGet();
    }

    public void Draw() {
    }

    public boolean HitTest(String area, float x, float y) {
        float[] box = hitAreas.get(area);
        return box != null && x >= box[0] && x <= box[0] + box[2] && y >= box[1] && y <= box[1] + box[3];
    }

    public void Release() {
        released = true;
        parameters.clear();
    }

    /**
     * Declares a rectangular hit area, as a model manifest would.
     */
    public void defineHitArea(String area, float x, float y, float width, float height) {
        hitAreas.put(area, new float[]{x, y, width, height});
    }

    public boolean isReleased() {
        return released;
    }

    public String getManifest() {
        return manifest;
    }

    public String getLastMotion() {
        return lastMotion;
    }

    public float[] getLookTarget() {
        return new float[]{lookX, lookY};
    }

    public long getFrameCount() {
        return frames.get();
    }

    public Map<String, Float> snapshotParameters() {
        return new LinkedHashMap<>(parameters);
    }
}
