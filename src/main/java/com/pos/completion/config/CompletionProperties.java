package com.pos.completion.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Data;

/**
 * Tunable settings for the completion engine, bound from the {@code completion.*}
 * keys in {@code application.yml}.
 *
 * The matching thresholds are empirically tuned heuristics. They are kept here
 * rather than in the matchers so that deployments can adjust them without a
 * code change.
 */
@Data
@ConfigurationProperties("completion")
public class CompletionProperties {

    /**
     * Maximum number of worker threads used to evaluate display assignments.
     * A value of 1 (or less) evaluates inline on the calling thread.
     */
    private int parallelism = 4;

    private Identity identity = new Identity();

    private Model model = new Model();

    private Submission submission = new Submission();

    /** Store identity resolution settings ({@code completion.identity.*}). */
    @Data
    @ConfigurationProperties("identity")
    public static class Identity {

        /** Minimum confidence a method must reach for the pair to be accepted. */
        private double acceptanceThreshold = 0.85;

        /** Minimum token-Jaccard overlap for the strict partial name method. */
        private double partialOverlapThreshold = 0.85;

        /** Minimum number of shared tokens for the strict partial name method. */
        private int partialMinSharedTokens = 3;

        /** Shortest identifier/label considered by the identifier-in-name methods. */
        private int minIdentifierLength = 4;
    }

    /** Model name matching settings ({@code completion.model.*}). */
    @Data
    @ConfigurationProperties("model")
    public static class Model {

        /** Token-Jaccard similarity at or above which two model names match. */
        private double similarityThreshold = 0.80;
    }

    /** Survey submission validation settings ({@code completion.submission.*}). */
    @Data
    @ConfigurationProperties("submission")
    public static class Submission {

        /** Submissions scoring below this quality score are discarded. */
        private int minQualityScore = 30;
    }
}
