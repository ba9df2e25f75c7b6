package com.deskmate;

import com.deskmate.live2d.AnimationController;
import com.deskmate.models.ParameterTarget;
import com.deskmate.settings.PreferencesStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named expression presets, each a set of parameter targets applied through the
 * animation controller. Presets come from {@code expressions.json} in either form
 * {@code {"parameters": {...}}} or a flat map whose numeric entries are the parameters.
 */
public class ExpressionLibrary {

    private static final String COMPONENT = "ExpressionLibrary";

    private final PreferencesStore preferences;
    private final AnimationController animation;
    private volatile Map<String, Map<String, Double>> presets = Collections.emptyMap();

    public ExpressionLibrary(PreferencesStore preferences, AnimationController animation) {
        this.preferences = preferences;
        this.animation = animation;
        reload();
    }

    public void reload() {
        Map<String, Object> raw = preferences.loadExpressions();
        Map<String, Map<String, Double>> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (entry.getValue() instanceof Map) {
                parsed.put(entry.getKey(), extractParameters((Map<?, ?>) entry.getValue()));
            }
        }
        presets = Collections.unmodifiableMap(parsed);
        AppLogger.info(COMPONENT, "Loaded " + parsed.size() + " expression presets");
    }

    public List<String> listExpressions() {
        return new ArrayList<>(presets.keySet());
    }

    /**
     * Parameter values of a preset, or null when no preset has that name.
     */
    public Map<String, Double> get(String name) {
        return name != null ? presets.get(name) : null;
    }

    public boolean applyExpression(String name, double blend, boolean additive) {
        Map<String, Double> parameters = get(name);
        if (parameters == null) {
            return false;
        }
        animation.applyParameters(ParameterTarget.fromMap(parameters), blend, additive);
        return true;
    }

    public boolean applyParameters(Map<?, ?> parameters, double blend, boolean additive) {
        List<ParameterTarget> targets = ParameterTarget.fromMap(parameters);
        if (targets.isEmpty()) {
            return false;
        }
        return animation.applyParameters(targets, blend, additive);
    }

    /**
     * Restores a full parameter snapshot at full weight.
     */
    public boolean applySnapshot(Map<?, ?> snapshot) {
        return applyParameters(snapshot, 1.0, false);
    }

    static Map<String, Double> extractParameters(Map<?, ?> preset) {
        Object nested = preset.get("parameters");
        Map<?, ?> source = nested instanceof Map ? (Map<?, ?>) nested : preset;
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getKey() instanceof String && entry.getValue() instanceof Number) {
                values.put((String) entry.getKey(), ((Number) entry.getValue()).doubleValue());
            }
        }
        return Collections.unmodifiableMap(values);
    }
}
