package com.pos.completion.service;

import com.pos.completion.matching.IdentityResolver;
import com.pos.completion.model.AuditReport;
import com.pos.completion.model.CompletionResult;
import com.pos.completion.model.DisplayAssignment;
import com.pos.completion.model.IdentityDecision;
import com.pos.completion.model.PosmRequirement;
import com.pos.completion.model.StoreCatalogEntry;
import com.pos.completion.model.SurveySubmission;
import com.pos.completion.model.TimelineDay;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.ZoneId;
import java.util.List;

/**
 * Entry point for collaborators of the completion engine.
 *
 * All operations are pure with respect to their inputs: catalogs and
 * submissions are read, never modified, and nothing is retained between calls.
 * Fetching the inputs is the caller's responsibility.
 */
@Singleton
public class CompletionEngine {

    private final IdentityResolver identityResolver;
    private final CompletionAggregator aggregator;
    private final AuditReporter auditReporter;
    private final SubmissionTimeline submissionTimeline;

    @Inject
    public CompletionEngine(IdentityResolver identityResolver,
                            CompletionAggregator aggregator,
                            AuditReporter auditReporter,
                            SubmissionTimeline submissionTimeline) {
        this.identityResolver = identityResolver;
        this.aggregator = aggregator;
        this.auditReporter = auditReporter;
        this.submissionTimeline = submissionTimeline;
    }

    /**
     * Resolves whether a submission refers to the given catalog store.
     */
    public IdentityDecision resolveStoreIdentity(SurveySubmission submission,
                                                 String candidateStoreId,
                                                 List<StoreCatalogEntry> storeCatalog) {
        return resolveStoreIdentity(
                submission == null ? null : submission.leaderLabel(),
                submission == null ? null : submission.shopNameLabel(),
                candidateStoreId,
                storeCatalog);
    }

    public IdentityDecision resolveStoreIdentity(String leaderLabel,
                                                 String shopNameLabel,
                                                 String candidateStoreId,
                                                 List<StoreCatalogEntry> storeCatalog) {
        if (candidateStoreId == null || candidateStoreId.isBlank()) {
            return IdentityDecision.reject();
        }
        StoreDirectory directory = StoreDirectory.build(storeCatalog);
        return identityResolver.resolve(leaderLabel, shopNameLabel, candidateStoreId.strip(), directory.entries());
    }

    public CompletionResult computeCompletion(List<DisplayAssignment> displayAssignments,
                                              List<SurveySubmission> submissions,
                                              List<PosmRequirement> posmRequirements,
                                              List<StoreCatalogEntry> storeCatalog) {
        return aggregator.compute(displayAssignments, submissions, posmRequirements, storeCatalog);
    }

    public AuditReport auditCompletion(CompletionResult completionResult,
                                       List<DisplayAssignment> displayAssignments,
                                       List<SurveySubmission> submissions) {
        return auditReporter.audit(completionResult, displayAssignments, submissions);
    }

    public List<TimelineDay> timeline(List<SurveySubmission> submissions, ZoneId zone) {
        return submissionTimeline.build(submissions, zone);
    }
}
