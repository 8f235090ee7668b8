package com.pos.completion.matching;

import com.pos.completion.model.MatchMethod;

import java.util.OptionalDouble;

/**
 * Catalog store id equals the submission's leader label; legacy submissions
 * carry the store key in that field.
 */
public class ExactIdentifierStrategy implements IdentityMatchStrategy {

    static final double CONFIDENCE = 1.0;

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT_IDENTIFIER;
    }

    @Override
    public OptionalDouble evaluate(IdentityProbe probe) {
        if (!probe.storeId().isEmpty() && probe.storeId().equals(probe.leader())) {
            return OptionalDouble.of(CONFIDENCE);
        }
        return OptionalDouble.empty();
    }
}
