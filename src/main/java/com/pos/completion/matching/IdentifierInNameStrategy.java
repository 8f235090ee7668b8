package com.pos.completion.matching;

import com.pos.completion.model.MatchMethod;

import java.util.OptionalDouble;

/**
 * The catalog store id appears as a whole word inside the shop name label,
 * e.g. store {@code "HCM-0042"} and shop name {@code "Mobile World HCM-0042"}.
 */
public class IdentifierInNameStrategy implements IdentityMatchStrategy {

    static final double CONFIDENCE = 0.88;

    private final int minIdentifierLength;

    public IdentifierInNameStrategy(int minIdentifierLength) {
        this.minIdentifierLength = minIdentifierLength;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.IDENTIFIER_IN_NAME;
    }

    @Override
    public OptionalDouble evaluate(IdentityProbe probe) {
        if (WordContainment.containsWord(probe.shopName(), probe.storeId(), minIdentifierLength)) {
            return OptionalDouble.of(CONFIDENCE);
        }
        return OptionalDouble.empty();
    }
}
