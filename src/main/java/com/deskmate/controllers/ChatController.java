package com.deskmate.controllers;

import com.deskmate.AppLogger;
import com.deskmate.ChatOrchestrator;
import com.deskmate.models.StructuredResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for the conversation: sending messages, history and greeting.
 */
public class ChatController implements Controller {

    private static final String COMPONENT = "ChatController";

    private final ChatOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public ChatController(ChatOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/chat", this::sendMessage);
        app.get("/api/chat/history", this::getHistory);
        app.delete("/api/chat/history", this::resetHistory);
        app.get("/api/chat/greeting", this::getGreeting);
    }

    private void sendMessage(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String message = json != null && json.has("message") ? json.get("message").asText() : "";
            if (message.isBlank()) {
                ctx.status(400).json(Map.of("error", "Message is required"));
                return;
            }
            StructuredResponse response = orchestrator.sendUserMessage(message.trim());
            orchestrator.enqueue(response.getDirectives());
            ctx.json(toBody(response));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Chat request failed: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getHistory(Context ctx) {
        ctx.json(orchestrator.getHistory());
    }

    private void resetHistory(Context ctx) {
        orchestrator.resetHistory();
        ctx.json(Map.of("ok", true));
    }

    private void getGreeting(Context ctx) {
        ctx.json(Map.of("greeting", orchestrator.getGreeting()));
    }

    static Map<String, Object> toBody(StructuredResponse response) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", response.getText());
        body.put("status", response.getStatus().getValue());
        if (response.getError() != null) {
            body.put("error", response.getError());
        }
        body.put("directives", response.getDirectives());
        return body;
    }
}
