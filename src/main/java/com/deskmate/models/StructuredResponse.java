package com.deskmate.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;

public class StructuredResponse {
    private final String text;
    private final List<Directive> directives;
    private final ResponseStatus status;
    private final String error;
    private final JsonNode raw;

    public StructuredResponse(String text, List<Directive> directives, ResponseStatus status,
                              String error, JsonNode raw) {
        this.text = text != null ? text : "";
        this.directives = directives != null ? List.copyOf(directives) : Collections.emptyList();
        this.status = status != null ? status : ResponseStatus.OK;
        this.error = error;
        this.raw = raw;
    }

    public static StructuredResponse offline(String text) {
        return new StructuredResponse(text, null, ResponseStatus.OFFLINE, null, null);
    }

    public static StructuredResponse error(String text, String error) {
        return new StructuredResponse(text, null, ResponseStatus.ERROR, error, null);
    }

    public StructuredResponse withStatus(ResponseStatus newStatus, String newError) {
        return new StructuredResponse(text, directives, newStatus, newError, raw);
    }

    public String getText() {
        return text;
    }

    public List<Directive> getDirectives() {
        return directives;
    }

    public ResponseStatus getStatus() {
        return status;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonIgnore
    public JsonNode getRaw() {
        return raw;
    }

    @JsonIgnore
    public boolean isError() {
        return status == ResponseStatus.ERROR;
    }
}
