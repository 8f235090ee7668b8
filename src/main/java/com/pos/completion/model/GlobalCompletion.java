package com.pos.completion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Overview figures for the whole run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalCompletion {

    private int totalStores;

    /** Stores at 100% POSM completion. */
    private int storesWithCompletePosm;

    /** Distinct models across displayed assignments. */
    private int totalModels;

    private int totalRequiredPosm;

    private int totalCompletedPosm;

    private double overallCompletion;

    private CompletionStatus status;

    /** Store count per status code, in {@link CompletionStatus} declaration order. */
    @Builder.Default
    private Map<String, Integer> statusCounts = new LinkedHashMap<>();
}
