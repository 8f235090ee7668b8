package com.pos.completion.service;

/**
 * Completion percentage arithmetic shared by records and rollups.
 */
final class CompletionMath {

    private CompletionMath() {
    }

    /**
     * @return {@code completed / required * 100} rounded half-up to one decimal,
     * or 0.0 when nothing is required
     */
    static double rate(int completed, int required) {
        if (required <= 0) {
            return 0.0;
        }
        return Math.round(completed * 1000.0 / required) / 10.0;
    }
}
