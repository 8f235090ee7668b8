package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Completion status derived purely from completed vs required POSM counts.
 *
 * <ul>
 *   <li>COMPLETE      - every required POSM code has been confirmed.</li>
 *   <li>PARTIAL       - some, but not all, required codes have been confirmed.</li>
 *   <li>NOT_VERIFIED  - codes are required but none has been confirmed.</li>
 *   <li>NO_DISPLAYS   - nothing is required (model without POSM requirements).</li>
 * </ul>
 */
public enum CompletionStatus {

    COMPLETE("complete"),
    PARTIAL("partial"),
    NOT_VERIFIED("not_verified"),
    NO_DISPLAYS("no_displays");

    private final String code;

    CompletionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Classifies a completed/required pair. Callers cap {@code completed} at
     * {@code required} beforehand.
     */
    public static CompletionStatus of(int completed, int required) {
        if (required == 0) {
            return NO_DISPLAYS;
        }
        if (completed == 0) {
            return NOT_VERIFIED;
        }
        if (completed == required) {
            return COMPLETE;
        }
        return PARTIAL;
    }
}
