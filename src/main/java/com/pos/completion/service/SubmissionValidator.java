package com.pos.completion.service;

import com.pos.completion.config.CompletionProperties;
import com.pos.completion.model.ModelResponse;
import com.pos.completion.model.SubmissionRef;
import com.pos.completion.model.SurveySubmission;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Filters out corrupt or incomplete survey submissions before they can
 * contribute evidence.
 *
 * <p>A submission is rejected when:
 * <ul>
 *   <li>it has no model responses;</li>
 *   <li>none of its responses carries a POSM selection;</li>
 *   <li>it has neither a shop name nor a leader label;</li>
 *   <li>its quality score is below {@code completion.submission.min-quality-score}.</li>
 * </ul>
 */
@Singleton
public class SubmissionValidator {

    private static final Logger log = LoggerFactory.getLogger(SubmissionValidator.class);

    // Quality score weights
    static final int SCORE_RESPONSES = 30;
    static final int SCORE_POSM_SELECTIONS = 40;
    static final int SCORE_SHOP_NAME = 15;
    static final int SCORE_LEADER = 10;
    static final int SCORE_TIMESTAMP = 5;
    static final int MAX_SCORE = 100;

    private final int minQualityScore;

    @Inject
    public SubmissionValidator(CompletionProperties properties) {
        this(properties.getSubmission().getMinQualityScore());
    }

    public SubmissionValidator(int minQualityScore) {
        this.minQualityScore = minQualityScore;
    }

    /**
     * Validates every submission, keeping input order.
     *
     * @param submissions raw submissions (null elements are rejected)
     * @return accepted submissions with their references, plus the rejection count
     */
    public ValidationOutcome validate(List<SurveySubmission> submissions) {
        List<ValidatedSubmission> accepted = new ArrayList<>();
        int rejected = 0;

        for (int i = 0; i < submissions.size(); i++) {
            SurveySubmission submission = submissions.get(i);
            Optional<String> reason = rejectionReason(submission);
            if (reason.isPresent()) {
                rejected++;
                log.debug("Submission #{} rejected: {}", i, reason.get());
                continue;
            }
            accepted.add(new ValidatedSubmission(referenceOf(submission, i), submission, qualityScore(submission)));
        }

        if (rejected > 0) {
            log.warn("Submission validation rejected={} accepted={} raw={}",
                    rejected, accepted.size(), submissions.size());
        }
        return new ValidationOutcome(List.copyOf(accepted), rejected);
    }

    /**
     * @return why the submission must not contribute, or empty when it is usable
     */
    public Optional<String> rejectionReason(SurveySubmission submission) {
        if (submission == null) {
            return Optional.of("missing submission");
        }
        if (submission.modelResponses().isEmpty()) {
            return Optional.of("no model responses");
        }
        if (!hasPosmSelections(submission)) {
            return Optional.of("no POSM selections");
        }
        if (isBlank(submission.shopNameLabel()) && isBlank(submission.leaderLabel())) {
            return Optional.of("no identifying label");
        }
        int score = qualityScore(submission);
        if (score < minQualityScore) {
            return Optional.of("quality score " + score + " below " + minQualityScore);
        }
        return Optional.empty();
    }

    /**
     * Scores how complete a submission is, from 0 to 100.
     */
    public int qualityScore(SurveySubmission submission) {
        if (submission == null || submission.modelResponses().isEmpty()) {
            return 0;
        }
        int score = SCORE_RESPONSES;
        if (hasPosmSelections(submission)) {
            score += SCORE_POSM_SELECTIONS;
        }
        if (!isBlank(submission.shopNameLabel())) {
            score += SCORE_SHOP_NAME;
        }
        if (!isBlank(submission.leaderLabel())) {
            score += SCORE_LEADER;
        }
        if (submission.submittedAt() != null) {
            score += SCORE_TIMESTAMP;
        }
        return Math.min(score, MAX_SCORE);
    }

    /**
     * Builds the reference used for a submission at the given input position.
     */
    static SubmissionRef referenceOf(SurveySubmission submission, int index) {
        String key = isBlank(submission.submissionId()) ? "#" + index : submission.submissionId().strip();
        return new SubmissionRef(key, submission.submittedAt(), submission.modelResponses().size());
    }

    private static boolean hasPosmSelections(SurveySubmission submission) {
        for (ModelResponse response : submission.modelResponses()) {
            if (response != null && !response.posmSelections().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Result of validating a batch of submissions.
     */
    public record ValidationOutcome(List<ValidatedSubmission> accepted, int rejected) {
    }
}
