package com.example.layerflow.adapter;

import java.util.Locale;

/** Remote agent ecosystems a layer set can be built for. */
public enum AgentBackend {
    A2A("a2a"),
    ADK("adk");

    private final String code;

    AgentBackend(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AgentBackend fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AgentBackend backend : values()) {
                if (backend.code.equals(normalized)) {
                    return backend;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported agent backend: " + code);
    }
}
