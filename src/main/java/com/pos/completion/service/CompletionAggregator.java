package com.pos.completion.service;

import com.pos.completion.config.CompletionProperties;
import com.pos.completion.matching.IdentityResolver;
import com.pos.completion.matching.ModelMatcher;
import com.pos.completion.model.CapWarning;
import com.pos.completion.model.CompletionDiagnostics;
import com.pos.completion.model.CompletionRecord;
import com.pos.completion.model.CompletionResult;
import com.pos.completion.model.CompletionStatus;
import com.pos.completion.model.DisplayAssignment;
import com.pos.completion.model.ModelResponse;
import com.pos.completion.model.PosmRequirement;
import com.pos.completion.model.PosmSelection;
import com.pos.completion.model.StoreCatalogEntry;
import com.pos.completion.model.SubmissionRef;
import com.pos.completion.model.SurveySubmission;
import com.pos.completion.thread.MdcPropagatingExecutor;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Reconciles survey submissions against display assignments and computes POSM
 * completion for every displayed (store, model) pair.
 *
 * <p>Per assignment:
 * <ol>
 *   <li>find every validated submission whose labels resolve to the assignment's store;</li>
 *   <li>union the selected POSM codes of every response whose model matches, across
 *       all of those submissions (a store may be surveyed incrementally);</li>
 *   <li>compare the union with the model's requirement, capping at 100%.</li>
 * </ol>
 *
 * <p>Assignments are independent, so they are evaluated on a bounded worker pool.
 * Workers only read the shared catalogs and return their own record; results are
 * collected in input order, which keeps the output deterministic.
 *
 * The aggregator holds no state between runs.
 */
@Singleton
public class CompletionAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CompletionAggregator.class);

    static final String MDC_RUN_KEY = "completionRun";

    private static final AtomicLong RUN_SEQUENCE = new AtomicLong();

    private final IdentityResolver identityResolver;
    private final ModelMatcher modelMatcher;
    private final SubmissionValidator submissionValidator;
    private final CompletionRollups rollups;

    // Null when running inline
    private final MdcPropagatingExecutor executor;

    @Inject
    public CompletionAggregator(IdentityResolver identityResolver,
                                ModelMatcher modelMatcher,
                                SubmissionValidator submissionValidator,
                                CompletionRollups rollups,
                                CompletionProperties properties) {
        this.identityResolver = identityResolver;
        this.modelMatcher = modelMatcher;
        this.submissionValidator = submissionValidator;
        this.rollups = rollups;
        this.executor = properties.getParallelism() > 1
                ? new MdcPropagatingExecutor(properties.getParallelism(), "completion-worker")
                : null;
    }

    // -----------------------------------------------------------------------
    // Completion run
    // -----------------------------------------------------------------------

    /**
     * Runs a full completion computation over the given snapshot.
     *
     * Dirty records are skipped and counted in the diagnostics; the run never
     * fails because of input data.
     *
     * @param displays     display assignments (only active ones take part)
     * @param submissions  raw survey submissions
     * @param requirements POSM requirement catalog
     * @param stores       store catalog
     * @return per-store, per-model, per-region, per-POSM-type and global completion
     * @throws CompletionComputationException if a worker fails unexpectedly
     */
    public CompletionResult compute(List<DisplayAssignment> displays,
                                    List<SurveySubmission> submissions,
                                    List<PosmRequirement> requirements,
                                    List<StoreCatalogEntry> stores) {
        String runId = Long.toString(RUN_SEQUENCE.incrementAndGet());
        MDC.put(MDC_RUN_KEY, runId);
        try {
            log.info("Completion run started displays={} submissions={} requirements={} stores={}",
                    displays.size(), submissions.size(), requirements.size(), stores.size());

            StoreDirectory directory = StoreDirectory.build(stores);
            RequirementIndex index = RequirementIndex.build(requirements);

            // ---- Sanitize displays ---------------------------------------------
            List<DisplayAssignment> active = new ArrayList<>();
            int skippedDisplays = 0;
            int inactiveDisplays = 0;
            for (DisplayAssignment display : displays) {
                if (display == null || isBlank(display.storeId()) || isBlank(display.model())) {
                    skippedDisplays++;
                    continue;
                }
                if (!display.isActive()) {
                    inactiveDisplays++;
                    continue;
                }
                active.add(new DisplayAssignment(display.storeId().strip(), display.model().strip(),
                        display.displayed(), display.updatedAt()));
            }
            if (skippedDisplays > 0) {
                log.warn("Skipped {} display assignments without store id or model", skippedDisplays);
            }

            // ---- Validate submissions ------------------------------------------
            SubmissionValidator.ValidationOutcome validation = submissionValidator.validate(submissions);
            List<ValidatedSubmission> validated = validation.accepted();

            // ---- Evaluate every assignment -------------------------------------
            List<AssignmentEvaluation> evaluations = evaluateAll(active, validated, directory, index);

            List<CompletionRecord> records = new ArrayList<>(evaluations.size());
            List<CapWarning> capWarnings = new ArrayList<>();
            Set<String> matchedKeys = new HashSet<>();
            for (AssignmentEvaluation evaluation : evaluations) {
                records.add(evaluation.record());
                if (evaluation.capWarning() != null) {
                    capWarnings.add(evaluation.capWarning());
                }
                matchedKeys.addAll(evaluation.matchedSubmissionKeys());
            }

            List<SubmissionRef> orphaned = validated.stream()
                    .map(ValidatedSubmission::ref)
                    .filter(ref -> !matchedKeys.contains(ref.key()))
                    .collect(Collectors.toList());
            if (!orphaned.isEmpty()) {
                log.info("{} validated submissions matched no displayed store", orphaned.size());
            }

            CompletionDiagnostics diagnostics = new CompletionDiagnostics(
                    skippedDisplays,
                    inactiveDisplays,
                    directory.skipped(),
                    index.skipped(),
                    submissions.size(),
                    validated.size(),
                    validation.rejected(),
                    List.copyOf(capWarnings),
                    List.copyOf(orphaned));

            CompletionResult result = rollups.rollUp(records, directory, index, diagnostics);

            log.info("Completion run finished assignments={} stores={} overallCompletion={} capWarnings={} orphaned={}",
                    records.size(), result.perStore().size(), result.global().getOverallCompletion(),
                    capWarnings.size(), orphaned.size());
            return result;
        } finally {
            MDC.remove(MDC_RUN_KEY);
        }
    }

    // -----------------------------------------------------------------------
    // Per-assignment evaluation
    // -----------------------------------------------------------------------

    private List<AssignmentEvaluation> evaluateAll(List<DisplayAssignment> active,
                                                   List<ValidatedSubmission> validated,
                                                   StoreDirectory directory,
                                                   RequirementIndex index) {
        if (executor == null || active.size() <= 1) {
            return active.stream()
                    .map(display -> evaluate(display, validated, directory, index))
                    .collect(Collectors.toList());
        }

        List<CompletableFuture<AssignmentEvaluation>> futures = active.stream()
                .map(display -> CompletableFuture.supplyAsync(
                        () -> evaluate(display, validated, directory, index), executor))
                .collect(Collectors.toList());
        List<AssignmentEvaluation> evaluations = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<AssignmentEvaluation> future : futures) {
                evaluations.add(future.get());
            }
            return evaluations;
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new CompletionComputationException("Interrupted while evaluating display assignments", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            log.error("Display assignment evaluation failed", e.getCause());
            throw new CompletionComputationException("Failed to evaluate display assignments", e.getCause());
        }
    }

    /**
     * Evaluates a single display assignment. Pure function of its arguments.
     */
    AssignmentEvaluation evaluate(DisplayAssignment display,
                                  List<ValidatedSubmission> validated,
                                  StoreDirectory directory,
                                  RequirementIndex index) {
        String storeId = display.storeId();
        String model = display.model();

        List<ValidatedSubmission> matched = validated.stream()
                .filter(v -> identityResolver.resolve(
                        v.submission().leaderLabel(),
                        v.submission().shopNameLabel(),
                        storeId,
                        directory.entries()).accepted())
                .collect(Collectors.toList());

        List<ValidatedSubmission> contributing = matched.stream()
                .filter(v -> !responsesFor(v.submission(), model).isEmpty())
                .collect(Collectors.toList());

        // Cumulative union of confirmed codes across every contributing submission
        SortedSet<String> confirmed = contributing.stream()
                .flatMap(v -> responsesFor(v.submission(), model).stream())
                .flatMap(response -> response.posmSelections().stream())
                .filter(Objects::nonNull)
                .filter(PosmSelection::selected)
                .map(PosmSelection::posmCode)
                .filter(code -> !isBlank(code))
                .map(String::strip)
                .collect(Collectors.toCollection(TreeSet::new));

        int requiredCount = index.requiredCount(model);
        int rawCompleted = confirmed.size();
        int completedCount = rawCompleted;
        CapWarning capWarning = null;

        // ---- Anomaly cap ------------------------------------------------------
        if (rawCompleted > requiredCount) {
            log.warn("POSM completion capped store={} model={} confirmed={} required={} codes={}",
                    storeId, model, rawCompleted, requiredCount, confirmed);
            capWarning = new CapWarning(storeId, model, rawCompleted, requiredCount);
            completedCount = requiredCount;
        }

        CompletionRecord record = new CompletionRecord(
                storeId,
                model,
                requiredCount,
                completedCount,
                CompletionMath.rate(completedCount, requiredCount),
                CompletionStatus.of(completedCount, requiredCount),
                contributing.size(),
                capWarning != null,
                List.copyOf(confirmed),
                contributing.stream().map(ValidatedSubmission::ref).collect(Collectors.toUnmodifiableList()));

        List<String> matchedKeys = matched.stream()
                .map(v -> v.ref().key())
                .collect(Collectors.toUnmodifiableList());

        return new AssignmentEvaluation(record, capWarning, matchedKeys);
    }

    private List<ModelResponse> responsesFor(SurveySubmission submission, String model) {
        List<ModelResponse> responses = new ArrayList<>();
        for (ModelResponse response : submission.modelResponses()) {
            if (response != null && modelMatcher.matches(model, response.model())) {
                responses.add(response);
            }
        }
        return responses.isEmpty() ? Collections.emptyList() : responses;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @PreDestroy
    @Override
    public void close() {
        if (executor != null) {
            executor.close();
        }
    }

    /**
     * Outcome of one assignment: its record, the cap warning if the cap fired, and
     * the keys of every submission whose identity resolved to the store.
     */
    record AssignmentEvaluation(CompletionRecord record, CapWarning capWarning, List<String> matchedSubmissionKeys) {
    }
}
