package com.pos.completion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rollup by POSM code: in how many stores the material is required, and in how
 * many of those it has been confirmed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PosmTypeCompletion {

    private String posmCode;

    private String posmName;

    private int requiredStores;

    private int completedStores;

    private double completionRate;
}
