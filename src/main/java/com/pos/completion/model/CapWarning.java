package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raised when the confirmed POSM count for an assignment exceeded the number of
 * required codes and had to be capped.
 */
public record CapWarning(

        @JsonProperty("storeId")
        String storeId,

        @JsonProperty("model")
        String model,

        @JsonProperty("rawCompletedCount")
        int rawCompletedCount,

        @JsonProperty("requiredCount")
        int requiredCount

) {
}
