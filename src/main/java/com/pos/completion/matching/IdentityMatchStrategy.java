package com.pos.completion.matching;

import com.pos.completion.model.MatchMethod;

import java.util.OptionalDouble;

/**
 * One tier of the store identity cascade.
 *
 * A strategy either declines the pair (empty result) or reports the confidence
 * with which it believes the submission refers to the candidate store. The
 * {@link IdentityResolver} decides whether that confidence is high enough.
 */
public interface IdentityMatchStrategy {

    MatchMethod method();

    OptionalDouble evaluate(IdentityProbe probe);
}
