package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Diagnostic annotation of a {@link CompletionResult}. Never alters the result.
 */
public record AuditReport(

        @JsonProperty("summary")
        AuditSummary summary,

        @JsonProperty("storeFindings")
        List<AuditFinding> storeFindings,

        @JsonProperty("recommendations")
        List<String> recommendations

) {
}
