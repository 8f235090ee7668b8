package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Completion of a single display assignment (one store, one model).
 *
 * Recomputed on every run and never persisted.
 */
public record CompletionRecord(

        @JsonProperty("storeId")
        String storeId,

        @JsonProperty("model")
        String model,

        /**
         * Number of distinct POSM codes the model requires.
         */
        @JsonProperty("requiredCount")
        int requiredCount,

        /**
         * Number of distinct confirmed POSM codes, capped at {@link #requiredCount}.
         */
        @JsonProperty("completedCount")
        int completedCount,

        /**
         * Percentage between 0.0 and 100.0, rounded to one decimal.
         */
        @JsonProperty("completionRate")
        double completionRate,

        @JsonProperty("status")
        CompletionStatus status,

        /**
         * Number of validated submissions that carried a response for this model.
         */
        @JsonProperty("contributingSubmissionCount")
        int contributingSubmissionCount,

        /**
         * Whether the raw confirmed count exceeded the requirement and was capped.
         */
        @JsonProperty("capped")
        boolean capped,

        /**
         * Sorted union of every selected POSM code across contributing submissions
         * (before capping).
         */
        @JsonProperty("confirmedPosmCodes")
        List<String> confirmedPosmCodes,

        @JsonProperty("contributingSubmissions")
        List<SubmissionRef> contributingSubmissions

) {
}
