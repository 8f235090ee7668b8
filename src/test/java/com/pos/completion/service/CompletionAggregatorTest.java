package com.pos.completion.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pos.completion.config.CompletionProperties;
import com.pos.completion.matching.IdentityMatchStrategy;
import com.pos.completion.matching.IdentityProbe;
import com.pos.completion.matching.IdentityResolver;
import com.pos.completion.matching.ModelMatcher;
import com.pos.completion.model.CapWarning;
import com.pos.completion.model.CompletionRecord;
import com.pos.completion.model.CompletionResult;
import com.pos.completion.model.CompletionStatus;
import com.pos.completion.model.DisplayAssignment;
import com.pos.completion.model.MatchMethod;
import com.pos.completion.model.ModelResponse;
import com.pos.completion.model.PosmRequirement;
import com.pos.completion.model.PosmSelection;
import com.pos.completion.model.StoreCatalogEntry;
import com.pos.completion.model.StoreCompletion;
import com.pos.completion.model.SurveySubmission;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

import static com.pos.completion.Fixtures.T0;
import static com.pos.completion.Fixtures.concat;
import static com.pos.completion.Fixtures.display;
import static com.pos.completion.Fixtures.requirements;
import static com.pos.completion.Fixtures.response;
import static com.pos.completion.Fixtures.store;
import static com.pos.completion.Fixtures.submission;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

class CompletionAggregatorTest {

    private final List<CompletionAggregator> opened = new ArrayList<>();

    private CompletionAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = aggregator(1);
    }

    @AfterEach
    void tearDown() {
        opened.forEach(CompletionAggregator::close);
    }

    private CompletionAggregator aggregator(int parallelism) {
        CompletionProperties properties = new CompletionProperties();
        properties.setParallelism(parallelism);
        CompletionAggregator created = new CompletionAggregator(
                new IdentityResolver(properties),
                new ModelMatcher(properties),
                new SubmissionValidator(properties),
                new CompletionRollups(),
                properties);
        opened.add(created);
        return created;
    }

    private static CompletionRecord onlyRecord(CompletionResult result) {
        assertThat(result.perStore()).hasSize(1);
        assertThat(result.perStore().get(0).getRecords()).hasSize(1);
        return result.perStore().get(0).getRecords().get(0);
    }

    @Nested
    @DisplayName("single store scenarios")
    class SingleStore {

        private final List<DisplayAssignment> displays = List.of(display("S1", "M1"));
        private final List<StoreCatalogEntry> stores = List.of(store("S1", "S1 Official"));
        private final List<PosmRequirement> requirements = requirements("M1", "P1", "P2");

        @Test
        @DisplayName("should report half completion when one of two codes is confirmed")
        void partialCompletion() {
            SurveySubmission survey = submission("S1 Official", "Leader A", T0, new ModelResponse("M1", List.of(
                    new PosmSelection("P1", null, true),
                    new PosmSelection("P2", null, false))));

            CompletionRecord record = onlyRecord(aggregator.compute(displays, List.of(survey), requirements, stores));

            assertThat(record.requiredCount()).isEqualTo(2);
            assertThat(record.completedCount()).isEqualTo(1);
            assertThat(record.completionRate()).isEqualTo(50.0);
            assertThat(record.status()).isEqualTo(CompletionStatus.PARTIAL);
            assertThat(record.confirmedPosmCodes()).containsExactly("P1");
        }

        @Test
        @DisplayName("should union codes confirmed across separate submissions")
        void incrementalSurveys() {
            List<SurveySubmission> surveys = List.of(
                    submission("S1 Official", "Leader A", T0, response("M1", "P1")),
                    submission("S1 Official", "Leader A", T0.plusSeconds(3600), response("M1", "P2")));

            CompletionResult result = aggregator.compute(displays, surveys, requirements, stores);
            CompletionRecord record = onlyRecord(result);

            assertThat(record.completedCount()).isEqualTo(2);
            assertThat(record.completionRate()).isEqualTo(100.0);
            assertThat(record.status()).isEqualTo(CompletionStatus.COMPLETE);
            assertThat(record.contributingSubmissionCount()).isEqualTo(2);
            assertThat(result.perStore().get(0).getLastSurveyAt()).isEqualTo(T0.plusSeconds(3600));
        }

        @Test
        @DisplayName("should count overlapping confirmations once")
        void overlappingUnion() {
            List<PosmRequirement> fourCodes = requirements("M1", "A", "B", "C", "D");
            List<SurveySubmission> surveys = List.of(
                    submission("S1 Official", "Leader A", T0, response("M1", "A", "B")),
                    submission("S1 Official", "Leader A", T0, response("M1", "B", "C")));

            CompletionRecord record = onlyRecord(aggregator.compute(displays, surveys, fourCodes, stores));

            assertThat(record.completedCount()).isEqualTo(3);
            assertThat(record.completionRate()).isEqualTo(75.0);
            assertThat(record.confirmedPosmCodes()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("should cap completion and warn when more codes are confirmed than required")
        void anomalyCap() {
            SurveySubmission survey = submission("S1 Official", "Leader A", T0, response("M1", "P1", "P2", "P3"));

            CompletionResult result = aggregator.compute(displays, List.of(survey), requirements, stores);
            CompletionRecord record = onlyRecord(result);

            assertThat(record.completedCount()).isEqualTo(2);
            assertThat(record.completionRate()).isEqualTo(100.0);
            assertThat(record.capped()).isTrue();
            assertThat(result.diagnostics().capWarnings()).containsExactly(new CapWarning("S1", "M1", 3, 2));
        }

        @Test
        @DisplayName("should cap at zero for a model without requirements")
        void capWithoutRequirements() {
            SurveySubmission survey = submission("S1 Official", "Leader A", T0, response("M1", "P1"));

            CompletionResult result = aggregator.compute(displays, List.of(survey), List.of(), stores);
            CompletionRecord record = onlyRecord(result);

            assertThat(record.completedCount()).isZero();
            assertThat(record.completionRate()).isZero();
            assertThat(record.status()).isEqualTo(CompletionStatus.NO_DISPLAYS);
            assertThat(result.diagnostics().capWarnings()).containsExactly(new CapWarning("S1", "M1", 1, 0));
        }

        @Test
        @DisplayName("should report not verified when no submission matches the store")
        void noEvidence() {
            SurveySubmission elsewhere = submission("Another Shop", "Leader B", T0, response("M1", "P1"));

            CompletionResult result = aggregator.compute(displays, List.of(elsewhere), requirements, stores);
            CompletionRecord record = onlyRecord(result);

            assertThat(record.status()).isEqualTo(CompletionStatus.NOT_VERIFIED);
            assertThat(record.contributingSubmissions()).isEmpty();
            assertThat(result.diagnostics().orphanedSubmissions())
                    .extracting(ref -> ref.key())
                    .containsExactly("#0");
        }

        @Test
        @DisplayName("should not count a matched submission without a response for the model")
        void matchedButOtherModel() {
            SurveySubmission otherModel = submission("S1 Official", "Leader A", T0, response("Z Fold", "P1"));

            CompletionResult result = aggregator.compute(displays, List.of(otherModel), requirements, stores);
            CompletionRecord record = onlyRecord(result);

            assertThat(record.contributingSubmissionCount()).isZero();
            assertThat(record.completedCount()).isZero();
            assertThat(result.diagnostics().orphanedSubmissions()).isEmpty();
        }

        @Test
        @DisplayName("should ignore selections confirmed for a different store")
        void otherStoreEvidenceIgnored() {
            List<DisplayAssignment> twoStores = List.of(display("S1", "M1"), display("S2", "M1"));
            List<StoreCatalogEntry> catalog = List.of(store("S1", "S1 Official"), store("S2", "S2 Official"));
            SurveySubmission survey = submission("S2 Official", "Leader B", T0, response("M1", "P1", "P2"));

            CompletionResult result = aggregator.compute(twoStores, List.of(survey), requirements, catalog);

            assertThat(result.perStore()).extracting(StoreCompletion::getStoreId, StoreCompletion::getCompletedPosm)
                    .containsExactly(
                            tuple("S2", 2),
                            tuple("S1", 0));
        }
    }

    @Nested
    @DisplayName("dirty input")
    class DirtyInput {

        @Test
        @DisplayName("should skip and count unusable records without failing the run")
        void skipsAndCounts() {
            List<DisplayAssignment> displays = Arrays.asList(
                    display("S1", "M1"),
                    new DisplayAssignment(null, "M1", true, T0),
                    new DisplayAssignment("S1", " ", true, T0),
                    new DisplayAssignment("S1", "M2", false, T0),
                    null);
            List<StoreCatalogEntry> stores = Arrays.asList(
                    store("S1", "S1 Official"),
                    new StoreCatalogEntry(" ", "Nameless", null, null, null));
            List<PosmRequirement> requirements = concat(
                    requirements("M1", "P1"),
                    List.of(new PosmRequirement("M1", null, null)));
            List<SurveySubmission> submissions = List.of(
                    submission("S1 Official", "Leader A", T0, response("M1", "P1")),
                    submission("S1 Official", "Leader A", T0));

            CompletionResult result = aggregator.compute(displays, submissions, requirements, stores);

            assertThat(result.perStore()).hasSize(1);
            assertThat(result.diagnostics().skippedDisplays()).isEqualTo(3);
            assertThat(result.diagnostics().inactiveDisplays()).isEqualTo(1);
            assertThat(result.diagnostics().skippedStores()).isEqualTo(1);
            assertThat(result.diagnostics().skippedRequirements()).isEqualTo(1);
            assertThat(result.diagnostics().rawSubmissions()).isEqualTo(2);
            assertThat(result.diagnostics().validatedSubmissions()).isEqualTo(1);
            assertThat(result.diagnostics().rejectedSubmissions()).isEqualTo(1);
            assertThat(result.global().getOverallCompletion()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("should treat a missing displayed flag as displayed")
        void nullDisplayedFlag() {
            CompletionResult result = aggregator.compute(
                    List.of(new DisplayAssignment("S1", "M1", null, null)),
                    List.of(), requirements("M1", "P1"), List.of(store("S1", "S1 Official")));

            assertThat(result.perStore()).hasSize(1);
            assertThat(result.diagnostics().inactiveDisplays()).isZero();
        }

        @Test
        @DisplayName("should return empty rollups for empty input")
        void emptyInput() {
            CompletionResult result = aggregator.compute(List.of(), List.of(), List.of(), List.of());

            assertThat(result.perStore()).isEmpty();
            assertThat(result.global().getTotalStores()).isZero();
            assertThat(result.global().getOverallCompletion()).isZero();
            assertThat(result.global().getStatus()).isEqualTo(CompletionStatus.NO_DISPLAYS);
        }
    }

    @Nested
    @DisplayName("rollups")
    class Rollups {

        private CompletionResult result;

        @BeforeEach
        void compute() {
            List<DisplayAssignment> displays = List.of(
                    display("S1", "M1"),
                    display("S2", "M1"),
                    display("S2", "M2"),
                    display("S3", "M1"));
            List<StoreCatalogEntry> stores = List.of(
                    store("S1", "S1 Official", "North", "Ha Noi"),
                    store("S2", "S2 Official", "South", "Ho Chi Minh"));
            List<PosmRequirement> requirements = concat(
                    requirements("M1", "P1", "P2"),
                    requirements("M2", "Q1", "Q2", "Q3", "Q4", "Q5", "Q6", "Q7", "Q8"));
            List<SurveySubmission> submissions = List.of(
                    submission("S1 Official", "Leader A", T0, response("M1", "P1")),
                    submission("S2 Official", "Leader B", T0, response("M1", "P1", "P2")));

            result = aggregator.compute(displays, submissions, requirements, stores);
        }

        @Test
        @DisplayName("should weight store completion by required POSM count")
        void storeWeighting() {
            StoreCompletion s2 = result.perStore().stream()
                    .filter(store -> store.getStoreId().equals("S2"))
                    .findFirst()
                    .orElseThrow();

            assertThat(s2.getTotalRequiredPosm()).isEqualTo(10);
            assertThat(s2.getCompletedPosm()).isEqualTo(2);
            assertThat(s2.getCompletionRate()).isEqualTo(20.0);
            assertThat(s2.getModels()).containsExactly("M1", "M2");
            assertThat(s2.getVerifiedModels()).containsExactly("M1");
        }

        @Test
        @DisplayName("should sort stores by descending completion rate")
        void storeOrder() {
            assertThat(result.perStore()).extracting(StoreCompletion::getStoreId).containsExactly("S1", "S2", "S3");
            assertThat(result.perStore()).extracting(StoreCompletion::getCompletionRate)
                    .containsExactly(50.0, 20.0, 0.0);
        }

        @Test
        @DisplayName("should fall back to the store id and Unknown region for uncatalogued stores")
        void uncataloguedStore() {
            StoreCompletion s3 = result.perStore().get(2);

            assertThat(s3.getStoreName()).isEqualTo("S3");
            assertThat(s3.getRegion()).isEqualTo("Unknown");
            assertThat(result.perRegion()).extracting(region -> region.getRegion())
                    .containsExactly("North", "South", "Unknown");
        }

        @Test
        @DisplayName("should roll up models with display and store counts")
        void perModel() {
            assertThat(result.perModel()).hasSize(2);
            assertThat(result.perModel().get(0).getModel()).isEqualTo("M1");
            assertThat(result.perModel().get(0).getTotalDisplays()).isEqualTo(3);
            assertThat(result.perModel().get(0).getVerifiedDisplays()).isEqualTo(2);
            assertThat(result.perModel().get(0).getCompletedStores()).isEqualTo(1);
            assertThat(result.perModel().get(0).getCompletionRate()).isEqualTo(50.0);
        }

        @Test
        @DisplayName("should group model spellings that share a requirement set")
        void modelSpellingsGrouped() {
            CompletionResult spelled = aggregator.compute(
                    List.of(display("S1", "Galaxy S24"), display("S2", "galaxy-s24")),
                    List.of(submission("S1 Official", "Leader A", T0, response("Galaxy S24", "P1"))),
                    requirements("Galaxy S24", "P1", "P2"),
                    List.of(store("S1", "S1 Official"), store("S2", "S2 Official")));

            assertThat(spelled.perModel()).singleElement().satisfies(model -> {
                assertThat(model.getModel()).isEqualTo("Galaxy S24");
                assertThat(model.getTotalDisplays()).isEqualTo(2);
                assertThat(model.getStoreCount()).isEqualTo(2);
                assertThat(model.getRequiredPosm()).isEqualTo(4);
                assertThat(model.getCompletedPosm()).isEqualTo(1);
            });
            assertThat(spelled.global().getTotalModels()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report per-POSM-type store coverage")
        void perPosmType() {
            assertThat(result.perPosmType().get(0).getPosmCode()).isEqualTo("P1");
            assertThat(result.perPosmType().get(0).getRequiredStores()).isEqualTo(3);
            assertThat(result.perPosmType().get(0).getCompletedStores()).isEqualTo(2);
            assertThat(result.perPosmType().get(0).getPosmName()).isEqualTo("P1 material");
        }

        @Test
        @DisplayName("should summarise the run globally")
        void global() {
            assertThat(result.global().getTotalStores()).isEqualTo(3);
            assertThat(result.global().getTotalModels()).isEqualTo(2);
            assertThat(result.global().getTotalRequiredPosm()).isEqualTo(14);
            assertThat(result.global().getTotalCompletedPosm()).isEqualTo(3);
            assertThat(result.global().getOverallCompletion()).isEqualTo(21.4);
            assertThat(result.global().getStatusCounts())
                    .containsEntry("partial", 2)
                    .containsEntry("not_verified", 1)
                    .containsEntry("complete", 0);
        }

        @Test
        @DisplayName("should keep every record within its invariants")
        void recordInvariants() {
            result.perStore().stream()
                    .flatMap(store -> store.getRecords().stream())
                    .forEach(record -> {
                        assertThat(record.completedCount()).isBetween(0, record.requiredCount());
                        assertThat(record.completionRate()).isBetween(0.0, 100.0);
                        assertThat(record.status())
                                .isEqualTo(CompletionStatus.of(record.completedCount(), record.requiredCount()));
                    });
        }
    }

    @Nested
    @DisplayName("worker failures")
    class WorkerFailures {

        @Test
        @DisplayName("should wrap an unexpected worker error with its cause")
        void wrapsWorkerError() {
            CompletionProperties properties = new CompletionProperties();
            properties.setParallelism(2);
            IdentityMatchStrategy broken = new IdentityMatchStrategy() {
                @Override
                public MatchMethod method() {
                    return MatchMethod.EXACT_STORE_NAME;
                }

                @Override
                public OptionalDouble evaluate(IdentityProbe probe) {
                    throw new IllegalStateException("catalog corrupted");
                }
            };
            CompletionAggregator failing = new CompletionAggregator(
                    new IdentityResolver(List.of(broken), 0.85),
                    new ModelMatcher(properties),
                    new SubmissionValidator(properties),
                    new CompletionRollups(),
                    properties);
            opened.add(failing);

            Throwable thrown = catchThrowable(() -> failing.compute(
                    List.of(display("S1", "M1"), display("S2", "M1")),
                    List.of(submission("S1 Official", "Leader A", T0, response("M1", "P1"))),
                    requirements("M1", "P1"),
                    List.of(store("S1", "S1 Official"))));

            assertThat(thrown)
                    .isInstanceOf(CompletionComputationException.class)
                    .hasRootCauseInstanceOf(IllegalStateException.class)
                    .hasRootCauseMessage("catalog corrupted");
        }
    }

    @Nested
    @DisplayName("determinism")
    class Determinism {

        private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

        private final List<DisplayAssignment> displays = List.of(
                display("S1", "M1"), display("S2", "M1"), display("S2", "M2"), display("S3", "M2"));
        private final List<StoreCatalogEntry> stores = List.of(
                store("S1", "S1 Official"), store("S2", "S2 Official"), store("S3", "S3 Official"));
        private final List<PosmRequirement> requirements = concat(
                requirements("M1", "P1", "P2"), requirements("M2", "P1", "P3"));
        private final List<SurveySubmission> submissions = List.of(
                submission("S1 Official", "Leader A", T0, response("M1", "P2")),
                submission("S2 Official", "Leader B", T0, response("M1", "P1"), response("M2", "P3")),
                submission("S3 Official", "Leader C", T0, response("M2", "P1", "P3")));

        @Test
        @DisplayName("should produce byte-identical output for repeated runs")
        void idempotent() throws Exception {
            String first = mapper.writeValueAsString(aggregator.compute(displays, submissions, requirements, stores));
            String second = mapper.writeValueAsString(aggregator.compute(displays, submissions, requirements, stores));

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("should produce the same output on a worker pool as inline")
        void parallelMatchesInline() throws Exception {
            CompletionAggregator parallel = aggregator(4);

            String inline = mapper.writeValueAsString(aggregator.compute(displays, submissions, requirements, stores));
            String pooled = mapper.writeValueAsString(parallel.compute(displays, submissions, requirements, stores));

            assertThat(pooled).isEqualTo(inline);
        }
    }
}
