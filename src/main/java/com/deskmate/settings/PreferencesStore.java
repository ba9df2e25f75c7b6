package com.deskmate.settings;

import com.deskmate.AppLogger;
import com.deskmate.models.VisionConfig;
import com.deskmate.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key-value persistence for user settings, AI prompts, expression presets and the
 * vision configuration. Stored keys override the defaults, unknown keys are kept,
 * and missing keys fall back to {@link PreferenceDefaults}.
 */
public class PreferencesStore {

    private static final String COMPONENT = "PreferencesStore";

    private final Path userSettingsPath;
    private final Path aiPromptsPath;
    private final Path expressionsPath;
    private final Path visionDir;

    public PreferencesStore(Path dataDir) {
        this.userSettingsPath = dataDir.resolve("user_settings.json");
        this.aiPromptsPath = dataDir.resolve("ai_prompts.json");
        this.expressionsPath = dataDir.resolve("expressions.json");
        this.visionDir = dataDir.resolve("vision");
    }

    public Map<String, Object> loadUserSettings() {
        return load(userSettingsPath, PreferenceDefaults.USER_SETTINGS);
    }

    public Map<String, Object> saveUserSettings(Map<String, Object> data) throws IOException {
        return save(userSettingsPath, data, PreferenceDefaults.USER_SETTINGS);
    }

    public Map<String, Object> loadAiPrompts() {
        return load(aiPromptsPath, PreferenceDefaults.AI_PROMPTS);
    }

    public Map<String, Object> saveAiPrompts(Map<String, Object> data) throws IOException {
        return save(aiPromptsPath, data, PreferenceDefaults.AI_PROMPTS);
    }

    public Map<String, Object> loadExpressions() {
        return load(expressionsPath, PreferenceDefaults.EXPRESSIONS);
    }

    public Map<String, Object> saveExpressions(Map<String, Object> data) throws IOException {
        return save(expressionsPath, data, PreferenceDefaults.EXPRESSIONS);
    }

    public Path getVisionDir() {
        return visionDir;
    }

    /**
     * Loads the vision configuration, writing the defaults on first use.
     */
    public VisionConfig loadVisionConfig() {
        Path path = visionDir.resolve("config.json");
        try {
            if (!Files.exists(path)) {
                saveVisionConfig(new VisionConfig());
            }
            VisionConfig loaded = JsonStorage.readJson(path, VisionConfig.class);
            return loaded != null ? loaded : new VisionConfig();
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Failed to load vision config from " + path + ": " + e.getMessage());
            return new VisionConfig();
        }
    }

    public void saveVisionConfig(VisionConfig config) throws IOException {
        JsonStorage.writeJson(visionDir.resolve("config.json"), config != null ? config : new VisionConfig());
    }

    private Map<String, Object> load(Path path, Map<String, Object> defaults) {
        try {
            if (!Files.exists(path)) {
                JsonStorage.writeJsonMap(path, defaults);
            }
        } catch (IOException e) {
            AppLogger.warn(COMPONENT, "Failed to write defaults to " + path + ": " + e.getMessage());
        }
        try {
            return merge(defaults, JsonStorage.readJsonMap(path));
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Failed to read " + path + ", using defaults: " + e.getMessage());
            return new LinkedHashMap<>(defaults);
        }
    }

    private Map<String, Object> save(Path path, Map<String, Object> data, Map<String, Object> defaults)
        throws IOException {
        Map<String, Object> merged = merge(defaults, data);
        JsonStorage.writeJsonMap(path, merged);
        return merged;
    }

    static Map<String, Object> merge(Map<String, Object> defaults, Map<String, Object> data) {
        Map<String, Object> merged = new LinkedHashMap<>(defaults);
        if (data != null) {
            merged.putAll(data);
        }
        return merged;
    }
}
