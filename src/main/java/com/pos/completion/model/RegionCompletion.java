package com.pos.completion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Rollup of all stores in a region. Stores missing from the catalog fall under
 * {@code "Unknown"}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionCompletion {

    private String region;

    private int storeCount;

    private int provinceCount;

    @Builder.Default
    private List<String> provinces = new ArrayList<>();

    private int totalDisplays;

    private int requiredPosm;

    private int completedPosm;

    private double completionRate;

    private CompletionStatus status;
}
