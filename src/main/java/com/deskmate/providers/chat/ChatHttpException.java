package com.deskmate.providers.chat;

import java.io.IOException;

/**
 * Non-2xx answer from the chat endpoint. Keeps the status and the raw body so callers
 * can pull the provider's own error detail out of it.
 */
public class ChatHttpException extends IOException {

    private final int statusCode;
    private final String body;

    public ChatHttpException(int statusCode, String body) {
        super("Chat request failed (" + statusCode + "): " + body);
        this.statusCode = statusCode;
        this.body = body != null ? body : "";
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isRetryable() {
        return statusCode == 429 || (statusCode >= 500 && statusCode <= 599);
    }
}
