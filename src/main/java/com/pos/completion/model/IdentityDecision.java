package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of resolving a submission's store identity against one catalog store.
 */
public record IdentityDecision(

        @JsonProperty("accepted")
        boolean accepted,

        /**
         * Confidence of the accepting method, or 0.0 when rejected.
         */
        @JsonProperty("confidence")
        double confidence,

        @JsonProperty("method")
        MatchMethod method

) {

    public static IdentityDecision accept(MatchMethod method, double confidence) {
        return new IdentityDecision(true, confidence, method);
    }

    public static IdentityDecision reject() {
        return new IdentityDecision(false, 0.0, MatchMethod.NONE);
    }
}
