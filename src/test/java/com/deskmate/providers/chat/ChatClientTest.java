package com.deskmate.providers.chat;

import com.deskmate.directives.InlineDirectiveScanner;
import com.deskmate.directives.ResponseNormalizer;
import com.deskmate.models.ConversationTurn;
import com.deskmate.models.ResponseStatus;
import com.deskmate.models.StructuredResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChatClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static class RecordingTransport implements ChatTransport {
        final List<String> urls = new ArrayList<>();
        final List<JsonNode> payloads = new ArrayList<>();
        final List<String> keys = new ArrayList<>();
        JsonNode reply;
        IOException failure;
        RuntimeException crash;

        @Override
        public JsonNode postJson(String url, JsonNode payload, String apiKey) throws IOException {
            urls.add(url);
            payloads.add(payload);
            keys.add(apiKey);
            if (failure != null) {
                throw failure;
            }
            if (crash != null) {
                throw crash;
            }
            return reply;
        }
    }

    private ChatClient client(RecordingTransport transport, Map<String, Object> settings) {
        ChatClient client = new ChatClient(mapper, transport,
            new ResponseNormalizer(mapper, new InlineDirectiveScanner(mapper)));
        client.updateConfig(settings, Map.of("system_prompt", "Be nice."));
        return client;
    }

    @Test
    void missingUrlRepliesOfflineWithoutNetwork() {
        RecordingTransport transport = new RecordingTransport();
        StructuredResponse response = client(transport, Map.of("api_url", "  ")).send(List.of(), "hello");

        assertEquals(ResponseStatus.OFFLINE, response.getStatus());
        assertTrue(response.getText().endsWith("hello"));
        assertTrue(transport.urls.isEmpty());
    }

    @Test
    void buildsOpenAiStyleRequest() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.reply = mapper.readTree("{\"choices\":[{\"message\":{\"content\":\"Hi! {\\\"type\\\":\\\"motion\\\",\\\"group\\\":\\\"Tap\\\"}\"}}]}");
        ChatClient client = client(transport, Map.of(
            "api_url", "https://api.openai.com",
            "api_key", "sk-test",
            "model", "gpt-4o-mini",
            "temperature", "0.7",
            "stream", false));

        StructuredResponse response = client.send(
            List.of(ConversationTurn.user("earlier"), ConversationTurn.assistant("reply")), "now");

        assertEquals("https://api.openai.com/v1/chat/completions", transport.urls.get(0));
        assertEquals("sk-test", transport.keys.get(0));
        JsonNode payload = transport.payloads.get(0);
        assertEquals("gpt-4o-mini", payload.get("model").asText());
        assertEquals(0.7, payload.get("temperature").asDouble(), 1e-9);
        assertFalse(payload.get("stream").asBoolean());
        JsonNode messages = payload.get("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("assistant", messages.get(2).get("role").asText());
        assertEquals("now", messages.get(3).get("content").asText());

        assertEquals(ResponseStatus.OK, response.getStatus());
        assertEquals("Hi!", response.getText());
        assertEquals(1, response.getDirectives().size());
    }

    @Test
    void deepSeekHostGetsPathAndModel() {
        RecordingTransport transport = new RecordingTransport();
        transport.reply = mapper.createObjectNode().put("reply", "ok");

        client(transport, Map.of("api_url", "api.deepseek.com", "model", "gpt-4o")).send(List.of(), "x");

        assertEquals("https://api.deepseek.com/chat/completions", transport.urls.get(0));
        assertEquals("deepseek-chat", transport.payloads.get(0).get("model").asText());
    }

    @Test
    void resolvesUrls() {
        assertEquals("", ChatClient.resolveUrl(null));
        assertEquals("https://example.com/", ChatClient.resolveUrl("example.com"));
        assertEquals("http://localhost:8080/v1/chat", ChatClient.resolveUrl("http://localhost:8080/v1/chat"));
        assertEquals("https://localhost:8080/api", ChatClient.resolveUrl("localhost:8080/api"));
        assertEquals("https://api.deepseek.com/v1/custom", ChatClient.resolveUrl("https://api.deepseek.com/v1/custom"));
        assertEquals("deepseek-coder", ChatClient.normalizeModel("deepseek-coder", "api.deepseek.com"));
        assertEquals("gpt-4o", ChatClient.normalizeModel("gpt-4o", "api.openai.com"));
    }

    @Test
    void httpErrorBecomesErrorResponseWithProviderDetail() {
        RecordingTransport transport = new RecordingTransport();
        transport.failure = new ChatHttpException(401, "{\"error\":{\"message\":\"Invalid API key\"}}");

        StructuredResponse response = client(transport, Map.of("api_url", "https://api.example.com/v1")).send(List.of(), "x");

        assertEquals(ResponseStatus.ERROR, response.getStatus());
        assertEquals("Invalid API key", response.getError());
        assertTrue(response.getText().contains("401"));
        assertTrue(response.getDirectives().isEmpty());
    }

    @Test
    void errorDetailFallsBackToMessageOrBody() {
        ChatClient client = client(new RecordingTransport(), Map.of());

        assertEquals("quota", client.extractErrorDetail(new ChatHttpException(429, "{\"message\":\"quota\"}")));
        assertEquals("bad", client.extractErrorDetail(new ChatHttpException(400, "{\"detail\":\"bad\"}")));
        assertEquals("Bad Gateway", client.extractErrorDetail(new ChatHttpException(502, "Bad Gateway")));
        assertEquals("HTTP 500", client.extractErrorDetail(new ChatHttpException(500, "")));
    }

    @Test
    void transportFailureNeverThrows() {
        RecordingTransport transport = new RecordingTransport();
        transport.failure = new ConnectException("Connection refused");

        StructuredResponse response = client(transport, Map.of("api_url", "https://api.example.com")).send(List.of(), "x");

        assertEquals(ResponseStatus.ERROR, response.getStatus());
        assertTrue(response.getText().contains("Connection refused"));
    }

    @Test
    void nonHttpSchemeIsRejectedBeforeSending() {
        RecordingTransport transport = new RecordingTransport();

        StructuredResponse response = client(transport, Map.of("api_url", "ftp://chat.example.com/v1")).send(List.of(), "x");

        assertEquals(ResponseStatus.ERROR, response.getStatus());
        assertTrue(response.getError().contains("ftp"), response.getError());
        assertTrue(transport.urls.isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ChatClient.resolveUrl("ftp://chat.example.com"));
    }

    @Test
    void uncheckedTransportFailureBecomesErrorResponse() {
        RecordingTransport transport = new RecordingTransport();
        transport.crash = new IllegalArgumentException("invalid URI scheme");

        StructuredResponse response = client(transport, Map.of("api_url", "https://api.example.com")).send(List.of(), "x");

        assertEquals(ResponseStatus.ERROR, response.getStatus());
        assertEquals("invalid URI scheme", response.getError());
    }

    @Test
    void retryClassification() {
        assertTrue(HttpChatTransport.isRetryable(new ChatHttpException(503, "")));
        assertTrue(HttpChatTransport.isRetryable(new ChatHttpException(429, "")));
        assertFalse(HttpChatTransport.isRetryable(new ChatHttpException(401, "")));
        assertTrue(HttpChatTransport.isRetryable(new IOException("Connection reset by peer")));
        assertFalse(HttpChatTransport.isRetryable(new IOException("unknown host")));
    }
}
