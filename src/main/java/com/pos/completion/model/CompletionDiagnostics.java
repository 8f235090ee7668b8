package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Diagnostic trail of a completion run: what was skipped, what was capped and
 * which submissions matched no store.
 */
public record CompletionDiagnostics(

        /**
         * Display assignments skipped for a missing store id or model.
         */
        @JsonProperty("skippedDisplays")
        int skippedDisplays,

        /**
         * Display assignments excluded because they are explicitly not displayed.
         */
        @JsonProperty("inactiveDisplays")
        int inactiveDisplays,

        @JsonProperty("skippedStores")
        int skippedStores,

        @JsonProperty("skippedRequirements")
        int skippedRequirements,

        @JsonProperty("rawSubmissions")
        int rawSubmissions,

        @JsonProperty("validatedSubmissions")
        int validatedSubmissions,

        @JsonProperty("rejectedSubmissions")
        int rejectedSubmissions,

        @JsonProperty("capWarnings")
        List<CapWarning> capWarnings,

        /**
         * Validated submissions that resolved to none of the displayed stores.
         */
        @JsonProperty("orphanedSubmissions")
        List<SubmissionRef> orphanedSubmissions

) {
}
