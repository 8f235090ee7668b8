package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate figures of an audit run.
 */
public record AuditSummary(

        @JsonProperty("totalStores")
        int totalStores,

        @JsonProperty("storesAtFullCompletion")
        int storesAtFullCompletion,

        @JsonProperty("storesWithFindings")
        int storesWithFindings,

        @JsonProperty("capWarnings")
        int capWarnings,

        @JsonProperty("totalDisplayAssignments")
        int totalDisplayAssignments,

        @JsonProperty("totalSubmissions")
        int totalSubmissions,

        @JsonProperty("validatedSubmissions")
        int validatedSubmissions,

        @JsonProperty("orphanedSubmissions")
        int orphanedSubmissions,

        @JsonProperty("overallCompletion")
        double overallCompletion,

        /**
         * Store count per 10-point completion bucket ({@code "0-10"} .. {@code "90-100"},
         * plus {@code "100"} for fully complete stores).
         */
        @JsonProperty("completionDistribution")
        Map<String, Integer> completionDistribution,

        /**
         * Store count per status code.
         */
        @JsonProperty("statusHistogram")
        Map<String, Integer> statusHistogram

) {
}
