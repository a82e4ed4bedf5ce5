package com.jz.gateway.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageRole {
    @JsonProperty("user") USER("User"),
    @JsonProperty("assistant") ASSISTANT("Assistant"),
    @JsonProperty("system") SYSTEM("System");

    private final String label;

    MessageRole(String label) {
        this.label = label;
    }

    /** 拼上下文时的前缀，如 "User" */
    public String label() {
        return label;
    }
}
