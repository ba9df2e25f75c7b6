package com.deskmate.controllers;

import com.deskmate.AppLogger;
import com.deskmate.ChatOrchestrator;
import com.deskmate.ExpressionLibrary;
import com.deskmate.directives.InlineDirectiveScanner;
import com.deskmate.live2d.AnimationController;
import com.deskmate.live2d.Collider;
import com.deskmate.models.Directive;
import com.deskmate.models.ModelTransform;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Controller for the animated model: motions, expressions, transform, colliders and directive
 * injection. Writes and clicks are marshalled onto the animation thread.
 */
public class ModelController implements Controller {

    private static final String COMPONENT = "ModelController";
    private static final long ANIMATION_TIMEOUT_SECONDS = 2;

    private final AnimationController animation;
    private final ExpressionLibrary expressions;
    private final ChatOrchestrator orchestrator;
    private final InlineDirectiveScanner scanner;
    private final ScheduledExecutorService animationExecutor;
    private final ObjectMapper objectMapper;

    public ModelController(AnimationController animation, ExpressionLibrary expressions,
                           ChatOrchestrator orchestrator, InlineDirectiveScanner scanner,
                           ScheduledExecutorService animationExecutor, ObjectMapper objectMapper) {
        this.animation = animation;
        this.expressions = expressions;
        this.orchestrator = orchestrator;
        this.scanner = scanner;
        this.animationExecutor = animationExecutor;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/model/motions", ctx -> ctx.json(animation.listMotions()));
        app.get("/api/model/expressions", ctx -> ctx.json(expressions.listExpressions()));
        app.get("/api/model/transform", ctx -> ctx.json(animation.getTransform()));
        app.put("/api/model/transform", this::updateTransform);
        app.post("/api/model/directives", this::queueDirectives);
        app.get("/api/model/colliders", ctx -> ctx.json(animation.listColliders()));
        app.post("/api/model/colliders", this::registerCollider);
        app.delete("/api/model/colliders", ctx -> {
            animation.clearColliders();
            ctx.json(Map.of("ok", true));
        });
        app.delete("/api/model/colliders/{name}", ctx -> {
            String name = ctx.pathParam("name");
            if (!animation.removeCollider(name)) {
                ctx.status(404).json(Map.of("error", "Collider not found: " + name));
                return;
            }
            ctx.json(Map.of("ok", true));
        });
        app.post("/api/model/click", this::click);
    }

    private void registerCollider(Context ctx) {
        try {
            Collider collider = parseCollider(objectMapper.readTree(ctx.body()));
            animation.registerCollider(collider);
            ctx.status(201).json(collider);
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Failed to register collider: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void click(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            Double x = json != null ? number(json, "x") : null;
            Double y = json != null ? number(json, "y") : null;
            if (x == null || y == null) {
                ctx.status(400).json(Map.of("error", "x and y are required"));
                return;
            }
            List<String> hits = CompletableFuture.supplyAsync(() -> animation.onClick(x, y), animationExecutor)
                .get(ANIMATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            ctx.json(Map.of("hit", !hits.isEmpty(), "colliders", hits));
        } catch (ExecutionException e) {
            AppLogger.error(COMPONENT, "Click dispatch failed", e.getCause());
            ctx.status(500).json(Map.of("error", String.valueOf(e.getCause())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.status(500).json(Controller.errorBody(e));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Click dispatch failed: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * {@code {"type": "rect|circle|polygon|hitArea", "name": ..., ...shape fields}}.
     */
    static Collider parseCollider(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("A JSON object is required");
        }
        String name = json.path("name").asText("");
        String type = json.path("type").asText("");
        Collider collider;
        switch (type) {
            case "rect":
                collider = Collider.rect(name, required(json, "x"), required(json, "y"),
                    required(json, "width"), required(json, "height"));
                break;
            case "circle":
                collider = Collider.circle(name, required(json, "centerX"), required(json, "centerY"),
                    required(json, "radius"));
                break;
            case "polygon":
                JsonNode points = json.get("points");
                if (points == null || !points.isArray() || points.size() < 3) {
                    throw new IllegalArgumentException("polygon needs at least three [x, y] points");
                }
                List<double[]> vertices = new ArrayList<>();
                for (JsonNode point : points) {
                    if (!point.isArray() || point.size() < 2 || !point.get(0).isNumber() || !point.get(1).isNumber()) {
                        throw new IllegalArgumentException("polygon points must be [x, y] pairs");
                    }
                    vertices.add(new double[]{point.get(0).asDouble(), point.get(1).asDouble()});
                }
                collider = Collider.polygon(name, vertices);
                break;
            case "hitArea":
                collider = Collider.hitArea(name, json.path("area").asText(""));
                break;
            default:
                throw new IllegalArgumentException("Unknown collider type: " + type);
        }
        JsonNode enabled = json.get("enabled");
        if (enabled != null && enabled.isBoolean()) {
            collider.setEnabled(enabled.asBoolean());
        }
        return collider;
    }

    private static double required(JsonNode json, String field) {
        Double value = number(json, field);
        if (value == null) {
            throw new IllegalArgumentException("Missing numeric field: " + field);
        }
        return value;
    }

    private void updateTransform(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            if (json == null || !json.isObject()) {
                ctx.status(400).json(Map.of("error", "A JSON object is required"));
                return;
            }
            Double x = number(json, "x");
            Double y = number(json, "y");
            Double scale = number(json, "scale");
            if ((x == null) != (y == null)) {
                ctx.status(400).json(Map.of("error", "x and y must be given together"));
                return;
            }
            ModelTransform updated = CompletableFuture.supplyAsync(() -> {
                if (x != null) {
                    animation.setPosition(x, y);
                }
                if (scale != null) {
                    animation.setScale(scale);
                }
                return animation.getTransform();
            }, animationExecutor).get(ANIMATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            ctx.json(updated);
        } catch (ExecutionException e) {
            AppLogger.error(COMPONENT, "Transform update failed", e.getCause());
            ctx.status(500).json(Map.of("error", String.valueOf(e.getCause())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.status(500).json(Controller.errorBody(e));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Transform update failed: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * Accepts a directive object, an array of them, or {@code {"directives": [...]}}.
     */
    private void queueDirectives(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            if (json != null && json.isObject() && json.has("directives")) {
                json = json.get("directives");
            }
            if (json == null || !(json.isObject() || json.isArray())) {
                ctx.status(400).json(Map.of("error", "Expected a directive object or array"));
                return;
            }
            List<Directive> directives = scanner.classify(json);
            if (directives.isEmpty()) {
                ctx.status(400).json(Map.of("error", "No directives recognized"));
                return;
            }
            orchestrator.enqueue(directives);
            ctx.json(Map.of("queued", directives.size()));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Failed to queue directives: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private static Double number(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }
}
