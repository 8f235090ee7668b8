package com.pos.completion.matching;

import com.pos.completion.model.MatchMethod;

import java.util.OptionalDouble;

/**
 * Mirror of {@link IdentifierInNameStrategy}: the submission's leader label
 * appears as a whole word inside the candidate's catalog store name.
 */
public class LeaderLabelInNameStrategy implements IdentityMatchStrategy {

    static final double CONFIDENCE = 0.87;

    private final int minLabelLength;

    public LeaderLabelInNameStrategy(int minLabelLength) {
        this.minLabelLength = minLabelLength;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.LEADER_LABEL_IN_NAME;
    }

    @Override
    public OptionalDouble evaluate(IdentityProbe probe) {
        if (WordContainment.containsWord(probe.storeName(), probe.leader(), minLabelLength)) {
            return OptionalDouble.of(CONFIDENCE);
        }
        return OptionalDouble.empty();
    }
}
