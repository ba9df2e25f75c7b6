package com.deskmate.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Transport-level outcome of a chat backend call.
 */
public enum ResponseStatus {
    OK("ok"),
    OFFLINE("offline"),
    ERROR("error");

    private final String value;

    ResponseStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
