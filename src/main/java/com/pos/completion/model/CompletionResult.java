package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full output of a completion run. Every list is sorted by descending
 * completion rate; ties keep display catalog order.
 */
public record CompletionResult(

        @JsonProperty("perStore")
        List<StoreCompletion> perStore,

        @JsonProperty("perModel")
        List<ModelCompletion> perModel,

        @JsonProperty("perRegion")
        List<RegionCompletion> perRegion,

        @JsonProperty("perPosmType")
        List<PosmTypeCompletion> perPosmType,

        @JsonProperty("global")
        GlobalCompletion global,

        @JsonProperty("diagnostics")
        CompletionDiagnostics diagnostics

) {
}
