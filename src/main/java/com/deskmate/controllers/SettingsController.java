package com.deskmate.controllers;

import com.deskmate.AppLogger;
import com.deskmate.ChatOrchestrator;
import com.deskmate.settings.PreferencesStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for user settings, AI prompts and expression presets.
 * Every successful write reloads the live configuration.
 */
public class SettingsController implements Controller {

    private static final String COMPONENT = "SettingsController";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final PreferencesStore preferences;
    private final ChatOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public SettingsController(PreferencesStore preferences, ChatOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.preferences = preferences;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/settings", ctx -> ctx.json(preferences.loadUserSettings()));
        app.put("/api/settings", ctx -> update(ctx, "user settings", preferences::saveUserSettings));
        app.get("/api/prompts", ctx -> ctx.json(preferences.loadAiPrompts()));
        app.put("/api/prompts", ctx -> update(ctx, "AI prompts", preferences::saveAiPrompts));
        app.get("/api/expressions", ctx -> ctx.json(preferences.loadExpressions()));
        app.put("/api/expressions", ctx -> update(ctx, "expressions", preferences::saveExpressions));
        app.post("/api/config/reload", this::reload);
    }

    private void update(Context ctx, String label, Saver saver) {
        try {
            Map<String, Object> body = objectMapper.readValue(ctx.body(), MAP_TYPE);
            if (body == null) {
                throw new IllegalArgumentException("A JSON object is required");
            }
            Map<String, Object> saved = saver.save(body);
            orchestrator.reloadConfig();
            ctx.json(saved);
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON: " + e.getOriginalMessage()));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Failed to save " + label + ": " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void reload(Context ctx) {
        try {
            orchestrator.reloadConfig();
            ctx.json(Map.of("ok", true));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Failed to reload configuration: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    @FunctionalInterface
    private interface Saver {
        Map<String, Object> save(Map<String, Object> data) throws IOException;
    }
}
