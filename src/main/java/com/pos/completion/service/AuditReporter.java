package com.pos.completion.service;

import com.pos.completion.model.AuditConfidence;
import com.pos.completion.model.AuditFinding;
import com.pos.completion.model.AuditReport;
import com.pos.completion.model.AuditSummary;
import com.pos.completion.model.CompletionRecord;
import com.pos.completion.model.CompletionResult;
import com.pos.completion.model.CompletionStatus;
import com.pos.completion.model.DisplayAssignment;
import com.pos.completion.model.StoreCompletion;
import com.pos.completion.model.SubmissionRef;
import com.pos.completion.model.SurveySubmission;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags statistically suspicious completion results and summarises a run.
 *
 * <p>Per-store checks:
 * <ol>
 *   <li><b>MEDIUM</b> – the store is at 100% on the strength of a single submission
 *       that carries a single model response (not confirmed by repetition).</li>
 *   <li><b>MEDIUM</b> – at least one of the store's records hit the anomaly cap.</li>
 *   <li><b>LOW</b> – the store shows positive completion but no contributing
 *       submission is recorded for it.</li>
 * </ol>
 *
 * <p>The reporter is diagnostic only; it never alters the completion result.
 */
@Singleton
public class AuditReporter {

    private static final Logger log = LoggerFactory.getLogger(AuditReporter.class);

    static final double FULL_COMPLETION = 100.0;
    static final int BUCKET_WIDTH = 10;
    static final String FULL_BUCKET = "100";

    // Recommendation triggers
    static final double OVER_MATCHING_SHARE = 0.50;
    static final double SYSTEMIC_FINDINGS_SHARE = 0.10;

    /**
     * Audits a completion result.
     *
     * @param result      the aggregator's output
     * @param displays    the display assignments the result was computed from
     * @param submissions the raw submissions the result was computed from
     * @return summary, per-store findings and global recommendations
     */
    public AuditReport audit(CompletionResult result,
                             List<DisplayAssignment> displays,
                             List<SurveySubmission> submissions) {
        List<StoreCompletion> stores = result.perStore();

        List<AuditFinding> findings = new ArrayList<>();
        int storesAtFull = 0;
        for (StoreCompletion store : stores) {
            if (isFullyComplete(store)) {
                storesAtFull++;
            }
            AuditFinding finding = inspect(store);
            if (finding != null) {
                findings.add(finding);
            }
        }

        int capWarnings = result.diagnostics().capWarnings().size();
        int orphaned = result.diagnostics().orphanedSubmissions().size();

        AuditSummary summary = new AuditSummary(
                stores.size(),
                storesAtFull,
                findings.size(),
                capWarnings,
                displays.size(),
                submissions.size(),
                result.diagnostics().validatedSubmissions(),
                orphaned,
                result.global().getOverallCompletion(),
                completionDistribution(stores),
                statusHistogram(stores));

        List<String> recommendations = recommend(stores.size(), storesAtFull, findings.size(), capWarnings, orphaned);

        log.info("Audit finished stores={} atFullCompletion={} findings={} capWarnings={} recommendations={}",
                stores.size(), storesAtFull, findings.size(), capWarnings, recommendations.size());

        return new AuditReport(summary, List.copyOf(findings), List.copyOf(recommendations));
    }

    // -----------------------------------------------------------------------
    // Store-level checks
    // -----------------------------------------------------------------------

    AuditFinding inspect(StoreCompletion store) {
        AuditConfidence confidence = AuditConfidence.HIGH;
        List<String> issues = new ArrayList<>();
        List<SubmissionRef> contributing = store.getContributingSubmissions();

        // ---- 1. Full completion from one single-response submission --------
        if (isFullyComplete(store)
                && contributing.size() == 1
                && contributing.get(0).responseCount() == 1) {
            issues.add("100% completion rests on a single submission with a single model response ("
                    + contributing.get(0).key() + ")");
            confidence = confidence.min(AuditConfidence.MEDIUM);
        }

        // ---- 2. Capped records ---------------------------------------------
        for (CompletionRecord record : store.getRecords()) {
            if (record.capped()) {
                issues.add("Confirmed POSM count for model " + record.model() + " exceeded the "
                        + record.requiredCount() + " required codes and was capped");
                confidence = confidence.min(AuditConfidence.MEDIUM);
            }
        }

        // ---- 3. Completion without an evidence trail -----------------------
        if (store.getCompletedPosm() > 0 && contributing.isEmpty()) {
            issues.add("Positive completion (" + store.getCompletedPosm() + "/" + store.getTotalRequiredPosm()
                    + " POSM) without any contributing submission on record");
            confidence = confidence.min(AuditConfidence.LOW);
        }

        if (issues.isEmpty()) {
            return null;
        }
        log.debug("Audit finding store={} confidence={} issues={}", store.getStoreId(), confidence, issues);
        return new AuditFinding(store.getStoreId(), confidence, List.copyOf(issues));
    }

    // -----------------------------------------------------------------------
    // Distributions
    // -----------------------------------------------------------------------

    Map<String, Integer> completionDistribution(List<StoreCompletion> stores) {
        Map<String, Integer> buckets = new LinkedHashMap<>();
        for (int lower = 0; lower < FULL_COMPLETION; lower += BUCKET_WIDTH) {
            buckets.put(lower + "-" + (lower + BUCKET_WIDTH), 0);
        }
        buckets.put(FULL_BUCKET, 0);

        for (StoreCompletion store : stores) {
            buckets.merge(bucketOf(store.getCompletionRate(), isFullyComplete(store)), 1, Integer::sum);
        }
        return buckets;
    }

    /**
     * @param rate     rounded completion rate
     * @param complete whether every required code is confirmed; only complete
     *                 stores land in the {@code "100"} bucket, even when an
     *                 incomplete store's rate rounds up to 100.0
     */
    static String bucketOf(double rate, boolean complete) {
        if (complete) {
            return FULL_BUCKET;
        }
        int lower = Math.max(0, (int) (rate / BUCKET_WIDTH)) * BUCKET_WIDTH;
        lower = Math.min(lower, (int) FULL_COMPLETION - BUCKET_WIDTH);
        return lower + "-" + (lower + BUCKET_WIDTH);
    }

    // Status rather than rate: 1999/2000 rounds to 100.0 but is still partial
    private static boolean isFullyComplete(StoreCompletion store) {
        return store.getStatus() == CompletionStatus.COMPLETE;
    }

    Map<String, Integer> statusHistogram(List<StoreCompletion> stores) {
        Map<String, Integer> histogram = new LinkedHashMap<>();
        for (CompletionStatus status : CompletionStatus.values()) {
            histogram.put(status.getCode(), 0);
        }
        for (StoreCompletion store : stores) {
            histogram.merge(store.getStatus().getCode(), 1, Integer::sum);
        }
        return histogram;
    }

    // -----------------------------------------------------------------------
    // Recommendations
    // -----------------------------------------------------------------------

    List<String> recommend(int totalStores, int storesAtFull, int storesWithFindings, int capWarnings, int orphaned) {
        List<String> recommendations = new ArrayList<>();
        if (totalStores > 0 && storesAtFull > totalStores * OVER_MATCHING_SHARE) {
            recommendations.add(storesAtFull + " of " + totalStores
                    + " stores report 100% completion; review store identity matching for over-matching");
        }
        if (capWarnings > 0) {
            recommendations.add(capWarnings + " completion record(s) were capped; the POSM requirement catalog"
                    + " may have drifted from the codes used in surveys");
        }
        if (totalStores > 0 && storesWithFindings > totalStores * SYSTEMIC_FINDINGS_SHARE) {
            recommendations.add(storesWithFindings + " of " + totalStores
                    + " stores carry audit findings; a systematic review of survey evidence is warranted");
        }
        if (orphaned > 0) {
            recommendations.add(orphaned + " validated submission(s) matched no displayed store;"
                    + " check their shop names against the store catalog");
        }
        return recommendations;
    }
}
