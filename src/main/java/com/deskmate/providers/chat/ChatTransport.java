package com.deskmate.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Transport to an OpenAI-compatible chat completions endpoint.
 */
public interface ChatTransport {

    /**
     * POST a JSON payload and return the parsed response body. A body that is not JSON
     * comes back as a text node.
     *
     * @param url Fully resolved endpoint URL
     * @param payload Request body
     * @param apiKey Bearer key, or null/blank to send no Authorization header
     * @throws ChatHttpException when the endpoint answers with a non-2xx status
     */
    JsonNode postJson(String url, JsonNode payload, String apiKey) throws IOException, InterruptedException;
}
