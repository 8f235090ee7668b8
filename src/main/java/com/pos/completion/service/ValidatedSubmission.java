package com.pos.completion.service;

import com.pos.completion.model.SubmissionRef;
import com.pos.completion.model.SurveySubmission;

/**
 * A survey submission that passed validation, with its reference and quality score.
 */
public record ValidatedSubmission(SubmissionRef ref, SurveySubmission submission, int qualityScore) {
}
