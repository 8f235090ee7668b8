package com.pos.completion.matching;

import com.pos.completion.config.CompletionProperties;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Decides whether a model name in a survey response refers to the same model as
 * a display assignment. Free-text model names differ from the catalog in
 * spacing, punctuation and case.
 */
@Singleton
public class ModelMatcher {

    private final double similarityThreshold;

    @Inject
    public ModelMatcher(CompletionProperties properties) {
        this(properties.getModel().getSimilarityThreshold());
    }

    public ModelMatcher(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * @return {@code true} when the stripped tokens are equal, one contains the
     * other, or the word-level Jaccard similarity reaches the threshold
     */
    public boolean matches(String displayModel, String submissionModel) {
        String display = LabelNormalizer.normalizeModelToken(displayModel);
        String survey = LabelNormalizer.normalizeModelToken(submissionModel);
        if (display.isEmpty() || survey.isEmpty()) {
            return false;
        }

        if (display.equals(survey) || display.contains(survey) || survey.contains(display)) {
            return true;
        }

        double similarity = LabelNormalizer.jaccard(
                LabelNormalizer.words(displayModel), LabelNormalizer.words(submissionModel));
        return similarity >= similarityThreshold;
    }
}
