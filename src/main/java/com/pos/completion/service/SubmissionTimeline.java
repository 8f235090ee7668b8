package com.pos.completion.service;

import com.pos.completion.matching.LabelNormalizer;
import com.pos.completion.model.SurveySubmission;
import com.pos.completion.model.TimelineDay;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Buckets validated survey submissions by calendar day and adds running totals.
 *
 * Submissions without a timestamp cannot be placed on the timeline and are left
 * out. A surveyed store is keyed by its normalized leader label, or by its shop
 * name when the leader label is blank.
 */
@Singleton
public class SubmissionTimeline {

    private final SubmissionValidator submissionValidator;

    @Inject
    public SubmissionTimeline(SubmissionValidator submissionValidator) {
        this.submissionValidator = submissionValidator;
    }

    /**
     * @param submissions raw submissions
     * @param zone        zone in which calendar days are cut
     * @return one entry per day with activity, oldest first
     */
    public List<TimelineDay> build(List<SurveySubmission> submissions, ZoneId zone) {
        Map<LocalDate, DayAccumulator> days = new TreeMap<>();

        for (ValidatedSubmission validated : submissionValidator.validate(submissions).accepted()) {
            SurveySubmission submission = validated.submission();
            if (submission.submittedAt() == null) {
                continue;
            }
            LocalDate date = submission.submittedAt().atZone(zone).toLocalDate();
            DayAccumulator day = days.computeIfAbsent(date, d -> new DayAccumulator());
            day.surveys++;
            day.models += submission.modelResponses().size();
            day.stores.add(storeKey(submission));
        }

        List<TimelineDay> timeline = new ArrayList<>(days.size());
        int cumulativeSurveys = 0;
        int cumulativeModels = 0;
        Set<String> cumulativeStores = new HashSet<>();
        for (Map.Entry<LocalDate, DayAccumulator> entry : days.entrySet()) {
            DayAccumulator day = entry.getValue();
            cumulativeSurveys += day.surveys;
            cumulativeModels += day.models;
            cumulativeStores.addAll(day.stores);
            timeline.add(new TimelineDay(
                    entry.getKey(),
                    day.surveys,
                    day.models,
                    day.stores.size(),
                    cumulativeSurveys,
                    cumulativeModels,
                    cumulativeStores.size()));
        }
        return timeline;
    }

    private static String storeKey(SurveySubmission submission) {
        String leader = LabelNormalizer.normalizeLabel(submission.leaderLabel());
        return leader.isEmpty() ? LabelNormalizer.normalizeLabel(submission.shopNameLabel()) : leader;
    }

    private static final class DayAccumulator {
        int surveys;
        int models;
        final Set<String> stores = new HashSet<>();
    }
}
