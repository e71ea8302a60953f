package com.example.layerflow.factcheck;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Verdict {
    ACCURATE("accurate"),
    INACCURATE("inaccurate"),
    DISPUTED("disputed"),
    UNSUPPORTED("unsupported"),
    NOT_APPLICABLE("not_applicable");

    private final String code;

    Verdict(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** Lenient parse; anything unknown is treated as unsupported. */
    @JsonCreator
    public static Verdict fromCode(String code) {
        if (code == null) {
            return UNSUPPORTED;
        }
        String normalized = code.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (Verdict v : values()) {
            if (v.code.equals(normalized)) {
                return v;
            }
        }
        return UNSUPPORTED;
    }
}
