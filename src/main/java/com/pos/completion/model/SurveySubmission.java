package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A field survey as submitted by a surveyor.
 *
 * Store identity is free text; there is no foreign key to the store catalog.
 * The {@link com.pos.completion.matching.IdentityResolver} decides which
 * catalog store a submission refers to.
 */
public record SurveySubmission(

        /**
         * Optional identifier assigned by the submission store. When absent the
         * submission is referenced by its position in the input list.
         */
        @JsonProperty("submissionId")
        String submissionId,

        /**
         * Secondary label (team leader name in current data, store key in legacy data).
         */
        @JsonProperty("leaderLabel")
        String leaderLabel,

        /**
         * Free-text shop name entered by the surveyor.
         */
        @JsonProperty("shopNameLabel")
        String shopNameLabel,

        @JsonProperty("submittedAt")
        Instant submittedAt,

        @JsonProperty("modelResponses")
        List<ModelResponse> modelResponses

) {

    public SurveySubmission {
        modelResponses = modelResponses == null ? List.of() : modelResponses;
    }
}
