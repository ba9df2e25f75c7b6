package com.deskmate.providers.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link ChatTransport} over {@link HttpClient}, with retries for transient failures.
 */
public class HttpChatTransport implements ChatTransport {

    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
    protected static final int DEFAULT_MAX_RETRIES = 2;

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Duration timeout;
    private final int maxRetries;

    public HttpChatTransport(ObjectMapper mapper) {
        this(mapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
            Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS), DEFAULT_MAX_RETRIES);
    }

    public HttpChatTransport(ObjectMapper mapper, HttpClient httpClient, Duration timeout, int maxRetries) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
        this.maxRetries = Math.max(0, maxRetries);
    }

    @Override
    public JsonNode postJson(String url, JsonNode payload, String apiKey) throws IOException, InterruptedException {
        IOException lastIo = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return sendOnce(url, payload, apiKey);
            } catch (IOException e) {
                lastIo = e;
                if (attempt >= maxRetries || !isRetryable(e)) {
                    throw e;
                }
                sleepBackoff(attempt);
            }
        }
        throw lastIo != null ? lastIo : new IOException("Chat request failed");
    }

    private JsonNode sendOnce(String url, JsonNode payload, String apiKey) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));

        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey.trim());
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ChatHttpException(status, response.body());
        }
        String body = response.body() != null ? response.body() : "";
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    static boolean isRetryable(IOException e) {
        if (e instanceof ChatHttpException) {
            return ((ChatHttpException) e).isRetryable();
        }
        String msg = e.getMessage() != null ? e.getMessage() : "";
        return msg.contains("EOF reached while reading")
            || msg.contains("Connection reset")
            || msg.contains("timed out")
            || msg.contains("Timeout");
    }

    private void sleepBackoff(int attempt) throws InterruptedException {
        // 350ms, 900ms, 1800ms, then +1200ms per attempt, with jitter
        long base;
        if (attempt <= 0) base = 350;
        else if (attempt == 1) base = 900;
        else if (attempt == 2) base = 1800;
        else base = 2800L + 1200L * (attempt - 3);
        long jitter = ThreadLocalRandom.current().nextLong(0, 220);
        Thread.sleep(Math.min(10_000, base + jitter));
    }
}
