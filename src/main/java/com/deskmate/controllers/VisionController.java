package com.deskmate.controllers;

import com.deskmate.AppLogger;
import com.deskmate.models.VisionConfig;
import com.deskmate.models.VisionSnapshot;
import com.deskmate.vision.VisionService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for the screen vision producer.
 */
public class VisionController implements Controller {

    private static final String COMPONENT = "VisionController";

    private final VisionService visionService;
    private final ObjectMapper objectMapper;

    public VisionController(VisionService visionService, ObjectMapper objectMapper) {
        this.visionService = visionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/vision/status", ctx -> ctx.json(status()));
        app.post("/api/vision/start", ctx -> {
            visionService.start();
            ctx.json(status());
        });
        app.post("/api/vision/stop", ctx -> {
            visionService.stop();
            ctx.json(status());
        });
        app.post("/api/vision/simulate", this::simulate);
        app.get("/api/vision/history", ctx -> ctx.json(visionService.getHistory()));
    }

    private Map<String, Object> status() {
        VisionConfig config = visionService.getConfig();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", visionService.isRunning());
        status.put("enabled", config.isEnabled());
        status.put("captureInterval", config.getCaptureInterval());
        status.put("historySize", visionService.getHistory().size());
        return status;
    }

    private void simulate(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String text = json != null && json.has("text") ? json.get("text").asText() : "";
            if (text.isBlank()) {
                ctx.status(400).json(Map.of("error", "Text is required"));
                return;
            }
            Map<String, Object> meta = json.has("meta") && json.get("meta").isObject()
                ? objectMapper.convertValue(json.get("meta"), new TypeReference<LinkedHashMap<String, Object>>() {})
                : Map.of();
            VisionSnapshot snapshot = visionService.simulateDetection(text, meta);
            ctx.json(snapshot);
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Vision simulation failed: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
