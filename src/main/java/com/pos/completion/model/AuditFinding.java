package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Audit annotation for one store whose completion looks suspicious.
 */
public record AuditFinding(

        @JsonProperty("storeId")
        String storeId,

        @JsonProperty("confidence")
        AuditConfidence confidence,

        /**
         * Human-readable descriptions of every issue found, in detection order.
         */
        @JsonProperty("issues")
        List<String> issues

) {
}
