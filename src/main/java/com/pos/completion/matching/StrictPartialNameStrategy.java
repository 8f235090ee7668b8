package com.pos.completion.matching;

import com.pos.completion.model.MatchMethod;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Near-identical store names that differ only slightly in wording.
 *
 * <p>All of the following must hold:
 * <ol>
 *   <li>both labels have at least two significant tokens;</li>
 *   <li>token-Jaccard overlap reaches the configured threshold with enough shared tokens;</li>
 *   <li>token counts differ by at most one;</li>
 *   <li>one normalized label contains the other;</li>
 *   <li>numbered stores (label ending in a digit) match only exactly, so that
 *       {@code "branch 2"} is never merged with {@code "branch 20"}.</li>
 * </ol>
 *
 * <p>Confidence scales linearly with overlap from 0.75 (no overlap) to 0.90
 * (identical token sets).
 */
public class StrictPartialNameStrategy implements IdentityMatchStrategy {

    static final double BASE_CONFIDENCE = 0.75;
    static final double CONFIDENCE_SPAN = 0.15;

    private static final int MIN_TOKENS = 2;
    private static final int MAX_TOKEN_COUNT_DIFFERENCE = 1;

    private final double overlapThreshold;
    private final int minSharedTokens;

    public StrictPartialNameStrategy(double overlapThreshold, int minSharedTokens) {
        this.overlapThreshold = overlapThreshold;
        this.minSharedTokens = minSharedTokens;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.STRICT_PARTIAL_NAME;
    }

    @Override
    public OptionalDouble evaluate(IdentityProbe probe) {
        String shop = probe.shopName();
        String store = probe.storeName();
        if (shop.isEmpty() || store.isEmpty()) {
            return OptionalDouble.empty();
        }

        // Numbered-store guard: partial matching would conflate sibling branches
        if ((LabelNormalizer.endsWithDigit(shop) || LabelNormalizer.endsWithDigit(store)) && !shop.equals(store)) {
            return OptionalDouble.empty();
        }

        Set<String> shopTokens = LabelNormalizer.tokenize(shop);
        Set<String> storeTokens = LabelNormalizer.tokenize(store);
        if (shopTokens.size() < MIN_TOKENS || storeTokens.size() < MIN_TOKENS) {
            return OptionalDouble.empty();
        }
        if (Math.abs(shopTokens.size() - storeTokens.size()) > MAX_TOKEN_COUNT_DIFFERENCE) {
            return OptionalDouble.empty();
        }

        int shared = LabelNormalizer.sharedCount(shopTokens, storeTokens);
        double overlap = LabelNormalizer.jaccard(shopTokens, storeTokens);
        if (shared < minSharedTokens || overlap < overlapThreshold) {
            return OptionalDouble.empty();
        }

        if (!shop.contains(store) && !store.contains(shop)) {
            return OptionalDouble.empty();
        }

        return OptionalDouble.of(BASE_CONFIDENCE + CONFIDENCE_SPAN * overlap);
    }
}
