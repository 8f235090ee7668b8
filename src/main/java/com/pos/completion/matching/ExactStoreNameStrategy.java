package com.pos.completion.matching;

import com.pos.completion.model.MatchMethod;

import java.util.OptionalDouble;

/**
 * Catalog store name equals the submission's shop name label.
 */
public class ExactStoreNameStrategy implements IdentityMatchStrategy {

    static final double CONFIDENCE = 1.0;

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT_STORE_NAME;
    }

    @Override
    public OptionalDouble evaluate(IdentityProbe probe) {
        if (!probe.storeName().isEmpty() && probe.storeName().equals(probe.shopName())) {
            return OptionalDouble.of(CONFIDENCE);
        }
        return OptionalDouble.empty();
    }
}
