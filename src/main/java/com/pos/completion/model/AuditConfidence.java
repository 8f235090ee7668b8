package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How far a store's computed completion can be trusted.
 */
public enum AuditConfidence {

    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    AuditConfidence(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @return the lower of the two confidence levels
     */
    public AuditConfidence min(AuditConfidence other) {
        return this.ordinal() >= other.ordinal() ? this : other;
    }
}
