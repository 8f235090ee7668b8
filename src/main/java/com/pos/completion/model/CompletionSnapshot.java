package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body carrying the full input snapshot of a completion run.
 *
 * Absent lists are read as empty.
 */
public record CompletionSnapshot(

        @JsonProperty("displays")
        List<DisplayAssignment> displays,

        @JsonProperty("stores")
        List<StoreCatalogEntry> stores,

        @JsonProperty("requirements")
        List<PosmRequirement> requirements,

        @JsonProperty("submissions")
        List<SurveySubmission> submissions

) {

    public CompletionSnapshot {
        displays = displays == null ? List.of() : displays;
        stores = stores == null ? List.of() : stores;
        requirements = requirements == null ? List.of() : requirements;
        submissions = submissions == null ? List.of() : submissions;
    }
}
