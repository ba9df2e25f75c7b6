package com.deskmate.providers.chat;

import com.deskmate.AppLogger;
import com.deskmate.directives.ResponseNormalizer;
import com.deskmate.models.ConversationTurn;
import com.deskmate.models.StructuredResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for the configured chat endpoint. Builds an OpenAI-style request from the
 * conversation history and hands the answer to the {@link ResponseNormalizer}.
 * Failures never propagate: they come back as an error response whose text can be
 * shown to the user as-is.
 */
public class ChatClient {

    private static final String COMPONENT = "ChatClient";
    static final String OFFLINE_PREFIX = "(no chat endpoint configured, replying offline) ";
    static final String DEEPSEEK_DEFAULT_MODEL = "deepseek-chat";

    private final ObjectMapper mapper;
    private final ChatTransport transport;
    private final ResponseNormalizer normalizer;
    private volatile Map<String, Object> settings = Collections.emptyMap();
    private volatile Map<String, Object> prompts = Collections.emptyMap();

    public ChatClient(ObjectMapper mapper, ChatTransport transport, ResponseNormalizer normalizer) {
        this.mapper = mapper;
        this.transport = transport;
        this.normalizer = normalizer;
    }

    public void updateConfig(Map<String, Object> newSettings, Map<String, Object> newPrompts) {
        this.settings = newSettings != null ? new LinkedHashMap<>(newSettings) : Collections.emptyMap();
        this.prompts = newPrompts != null ? new LinkedHashMap<>(newPrompts) : Collections.emptyMap();
    }

    public StructuredResponse send(List<ConversationTurn> history, String userText) {
        Map<String, Object> currentSettings = settings;
        Map<String, Object> currentPrompts = prompts;

        String url;
        try {
            url = resolveUrl(stringValue(currentSettings.get("api_url")));
        } catch (IllegalArgumentException e) {
            AppLogger.warn(COMPONENT, "Invalid chat endpoint URL: " + e.getMessage());
            return StructuredResponse.error("The chat endpoint URL is invalid: " + e.getMessage(), e.getMessage());
        }
        if (url.isEmpty()) {
            return StructuredResponse.offline(OFFLINE_PREFIX + userText);
        }

        ObjectNode payload = buildPayload(currentSettings, currentPrompts, history, userText, hostOf(url));
        String apiKey = stringValue(currentSettings.get("api_key"));

        JsonNode body;
        try {
            body = transport.postJson(url, payload, apiKey);
        } catch (ChatHttpException e) {
            String detail = extractErrorDetail(e);
            AppLogger.warn(COMPONENT, "Chat service returned " + e.getStatusCode() + ": " + detail);
            return StructuredResponse.error(
                "The chat service answered with an error (" + e.getStatusCode() + "): " + detail, detail);
        } catch (IOException e) {
            AppLogger.error(COMPONENT, "Chat request failed", e);
            return StructuredResponse.error("Could not reach the chat service: " + describe(e), describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StructuredResponse.error("The chat request was interrupted", "interrupted");
        } catch (RuntimeException e) {
            AppLogger.error(COMPONENT, "Chat request could not be sent", e);
            return StructuredResponse.error("Could not send the chat request: " + describe(e), describe(e));
        }

        try {
            return normalizer.normalize(body);
        } catch (RuntimeException e) {
            AppLogger.error(COMPONENT, "Could not interpret chat response", e);
            return StructuredResponse.error("Could not interpret the chat service response: " + describe(e), describe(e));
        }
    }

    ObjectNode buildPayload(Map<String, Object> currentSettings, Map<String, Object> currentPrompts,
                            List<ConversationTurn> history, String userText, String host) {
        ObjectNode payload = mapper.createObjectNode();
        ArrayNode messages = payload.putArray("messages");
        String systemPrompt = stringValue(currentPrompts.get("system_prompt"));
        if (!systemPrompt.isEmpty()) {
            messages.addObject().put("role", "system").put("content", systemPrompt);
        }
        if (history != null) {
            for (ConversationTurn turn : history) {
                messages.addObject().put("role", turn.getRole().getValue()).put("content", turn.getContent());
            }
        }
        messages.addObject().put("role", "user").put("content", userText != null ? userText : "");

        String model = normalizeModel(stringValue(currentSettings.get("model")), host);
        if (!model.isEmpty()) {
            payload.put("model", model);
        }
        Object stream = currentSettings.get("stream");
        if (stream instanceof Boolean) {
            payload.put("stream", (Boolean) stream);
        }
        Object temperature = currentSettings.get("temperature");
        if (temperature instanceof Number) {
            payload.put("temperature", ((Number) temperature).doubleValue());
        } else if (temperature instanceof String) {
            try {
                payload.put("temperature", Double.parseDouble(((String) temperature).trim()));
            } catch (NumberFormatException ignored) {
            }
        }
        return payload;
    }

    /**
     * Scheme defaults to https and must be http or https. A bare DeepSeek host gets {@code /chat/completions},
     * a bare OpenAI host {@code /v1/chat/completions}. Blank input resolves to "".
     */
    static String resolveUrl(String value) {
        String url = value != null ? value.trim() : "";
        if (url.isEmpty()) {
            return "";
        }
        URI uri = URI.create(url);
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            uri = URI.create("https://" + url);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("unsupported scheme '" + uri.getScheme() + "' (use http or https)");
        }
        String host = uri.getRawAuthority().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath() != null ? uri.getRawPath() : "";

        if (isDeepSeekHost(host)) {
            if (path.isEmpty() || "/".equals(path)) {
                path = "/chat/completions";
            }
        } else if (host.contains("openai") && (path.isEmpty() || "/".equals(path))) {
            path = "/v1/chat/completions";
        }
        if (!path.startsWith("/")) {
            path = "/" + path;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority()).append(path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    /**
     * DeepSeek endpoints only accept DeepSeek models.
     */
    static String normalizeModel(String model, String host) {
        String normalized = model != null ? model.trim() : "";
        if (host != null && isDeepSeekHost(host.toLowerCase(Locale.ROOT))) {
            if (normalized.isEmpty()) {
                return DEEPSEEK_DEFAULT_MODEL;
            }
            if (!normalized.startsWith("deepseek")) {
                AppLogger.warn(COMPONENT, "Model " + normalized + " is not served by DeepSeek; using "
                    + DEEPSEEK_DEFAULT_MODEL);
                return DEEPSEEK_DEFAULT_MODEL;
            }
        }
        return normalized;
    }

    String extractErrorDetail(ChatHttpException e) {
        String body = e.getBody().trim();
        if (body.isEmpty()) {
            return "HTTP " + e.getStatusCode();
        }
        JsonNode data;
        try {
            data = mapper.readTree(body);
        } catch (IOException parseError) {
            return body;
        }
        if (data != null && data.isObject()) {
            JsonNode error = data.get("error");
            if (error != null && error.isObject()) {
                JsonNode message = error.get("message");
                return message != null && message.isTextual() ? message.asText() : error.toString();
            }
            for (String field : new String[]{"message", "detail"}) {
                JsonNode value = data.get(field);
                if (value != null && !value.isNull() && !value.asText().isEmpty()) {
                    return value.isValueNode() ? value.asText() : value.toString();
                }
            }
        }
        return data != null && data.isTextual() ? data.asText() : String.valueOf(data);
    }

    private static boolean isDeepSeekHost(String host) {
        String bare = host;
        int colon = bare.lastIndexOf(':');
        if (colon > 0) {
            bare = bare.substring(0, colon);
        }
        return bare.endsWith("deepseek.com");
    }

    private static String hostOf(String url) {
        String authority = URI.create(url).getRawAuthority();
        return authority != null ? authority : "";
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString().trim() : "";
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return m == null || m.isBlank() ? e.getClass().getSimpleName() : m;
    }
}
