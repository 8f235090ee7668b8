package com.pos.completion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rollup of every display assignment of one model across all stores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelCompletion {

    private String model;

    /** Number of display assignments for this model. */
    private int totalDisplays;

    /** Assignments with at least one contributing submission. */
    private int verifiedDisplays;

    private int storeCount;

    /** Stores whose assignment for this model is complete. */
    private int completedStores;

    private int requiredPosm;

    private int completedPosm;

    private double completionRate;

    private CompletionStatus status;
}
