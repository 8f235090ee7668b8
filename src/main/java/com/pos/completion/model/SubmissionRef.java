package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Lightweight reference to a survey submission, used in evidence trails and
 * diagnostics instead of the full payload.
 */
public record SubmissionRef(

        /**
         * The submission's own identifier, or {@code #<index>} for submissions
         * that carry none.
         */
        @JsonProperty("key")
        String key,

        @JsonProperty("submittedAt")
        Instant submittedAt,

        /**
         * Number of model responses in the submission.
         */
        @JsonProperty("responseCount")
        int responseCount

) {
}
