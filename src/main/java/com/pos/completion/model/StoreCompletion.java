package com.pos.completion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-store rollup of all display assignments of one store.
 *
 * Required and completed counts are summed over the store's models before the
 * rate is computed, so the rate is POSM-weighted rather than an average of
 * per-model rates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreCompletion {

    private String storeId;

    /** Catalog store name, or the store id when the store is not in the catalog. */
    private String storeName;

    private String region;

    private String province;

    private String channel;

    /** Models displayed at this store, in display catalog order. */
    @Builder.Default
    private List<String> models = new ArrayList<>();

    /** Models for which at least one validated submission carried a response. */
    @Builder.Default
    private List<String> verifiedModels = new ArrayList<>();

    private int totalRequiredPosm;

    private int completedPosm;

    private double completionRate;

    private CompletionStatus status;

    /** Most recent submission time among contributing submissions; null if none. */
    private Instant lastSurveyAt;

    /** Per-model completion records for this store. */
    @Builder.Default
    private List<CompletionRecord> records = new ArrayList<>();

    /** Distinct contributing submissions across all of the store's models. */
    @Builder.Default
    private List<SubmissionRef> contributingSubmissions = new ArrayList<>();
}
