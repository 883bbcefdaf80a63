package com.ai.trialmatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TurnRole {
    USER("user"),
    BOT("bot");

    private final String value;

    TurnRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
