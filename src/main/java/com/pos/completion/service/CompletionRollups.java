package com.pos.completion.service;

import com.pos.completion.matching.LabelNormalizer;
import com.pos.completion.model.CompletionDiagnostics;
import com.pos.completion.model.CompletionRecord;
import com.pos.completion.model.CompletionResult;
import com.pos.completion.model.CompletionStatus;
import com.pos.completion.model.GlobalCompletion;
import com.pos.completion.model.ModelCompletion;
import com.pos.completion.model.PosmTypeCompletion;
import com.pos.completion.model.RegionCompletion;
import com.pos.completion.model.StoreCatalogEntry;
import com.pos.completion.model.StoreCompletion;
import com.pos.completion.model.SubmissionRef;
import jakarta.inject.Singleton;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Rolls per-assignment completion records up to stores, models, regions, POSM
 * types and the global overview.
 *
 * Every rollup sums required and completed POSM counts first and divides last,
 * so larger requirements weigh more. Lists are sorted by descending completion
 * rate; the sort is stable, so ties keep display catalog order.
 */
@Singleton
public class CompletionRollups {

    static final String UNKNOWN = "Unknown";

    public CompletionResult rollUp(List<CompletionRecord> records,
                                   StoreDirectory directory,
                                   RequirementIndex index,
                                   CompletionDiagnostics diagnostics) {
        List<StoreCompletion> stores = byStore(records, directory);

        // Region rollup reads stores in catalog order, before sorting
        List<RegionCompletion> regions = byRegion(stores);
        List<ModelCompletion> models = byModel(records);
        List<PosmTypeCompletion> posmTypes = byPosmType(records, index);
        GlobalCompletion global = overview(stores, records);

        return new CompletionResult(
                sortedByRate(stores, StoreCompletion::getCompletionRate),
                sortedByRate(models, ModelCompletion::getCompletionRate),
                sortedByRate(regions, RegionCompletion::getCompletionRate),
                sortedByRate(posmTypes, PosmTypeCompletion::getCompletionRate),
                global,
                diagnostics);
    }

    // -----------------------------------------------------------------------
    // Per store
    // -----------------------------------------------------------------------

    List<StoreCompletion> byStore(List<CompletionRecord> records, StoreDirectory directory) {
        Map<String, List<CompletionRecord>> grouped = new LinkedHashMap<>();
        for (CompletionRecord record : records) {
            grouped.computeIfAbsent(record.storeId(), k -> new ArrayList<>()).add(record);
        }

        List<StoreCompletion> stores = new ArrayList<>(grouped.size());
        grouped.forEach((storeId, storeRecords) -> {
            StoreCatalogEntry entry = directory.get(storeId);

            int required = 0;
            int completed = 0;
            Set<String> models = new LinkedHashSet<>();
            Set<String> verifiedModels = new LinkedHashSet<>();
            Map<String, SubmissionRef> contributing = new LinkedHashMap<>();
            Instant lastSurveyAt = null;

            for (CompletionRecord record : storeRecords) {
                required += record.requiredCount();
                completed += record.completedCount();
                models.add(record.model());
                if (record.contributingSubmissionCount() > 0) {
                    verifiedModels.add(record.model());
                }
                for (SubmissionRef ref : record.contributingSubmissions()) {
                    contributing.putIfAbsent(ref.key(), ref);
                    if (ref.submittedAt() != null && (lastSurveyAt == null || ref.submittedAt().isAfter(lastSurveyAt))) {
                        lastSurveyAt = ref.submittedAt();
                    }
                }
            }

            stores.add(StoreCompletion.builder()
                    .storeId(storeId)
                    .storeName(entry != null && !isBlank(entry.storeName()) ? entry.storeName() : storeId)
                    .region(entry == null ? UNKNOWN : orUnknown(entry.region()))
                    .province(entry == null ? UNKNOWN : orUnknown(entry.province()))
                    .channel(entry == null ? UNKNOWN : orUnknown(entry.channel()))
                    .models(List.copyOf(models))
                    .verifiedModels(List.copyOf(verifiedModels))
                    .totalRequiredPosm(required)
                    .completedPosm(completed)
                    .completionRate(CompletionMath.rate(completed, required))
                    .status(CompletionStatus.of(completed, required))
                    .lastSurveyAt(lastSurveyAt)
                    .records(List.copyOf(storeRecords))
                    .contributingSubmissions(List.copyOf(contributing.values()))
                    .build());
        });
        return stores;
    }

    // -----------------------------------------------------------------------
    // Per model type
    // -----------------------------------------------------------------------

    List<ModelCompletion> byModel(List<CompletionRecord> records) {
        // Keyed like the requirement index; the first spelling seen labels the row
        Map<String, ModelAccumulator> grouped = new LinkedHashMap<>();
        for (CompletionRecord record : records) {
            ModelAccumulator acc = grouped.computeIfAbsent(
                    LabelNormalizer.normalizeModelToken(record.model()), k -> new ModelAccumulator(record.model()));
            acc.totalDisplays++;
            acc.stores.add(record.storeId());
            acc.required += record.requiredCount();
            acc.completed += record.completedCount();
            if (record.contributingSubmissionCount() > 0) {
                acc.verifiedDisplays++;
            }
            if (record.status() == CompletionStatus.COMPLETE) {
                acc.completedStores.add(record.storeId());
            }
        }

        List<ModelCompletion> models = new ArrayList<>(grouped.size());
        grouped.forEach((modelKey, acc) -> models.add(ModelCompletion.builder()
                .model(acc.label)
                .totalDisplays(acc.totalDisplays)
                .verifiedDisplays(acc.verifiedDisplays)
                .storeCount(acc.stores.size())
                .completedStores(acc.completedStores.size())
                .requiredPosm(acc.required)
                .completedPosm(acc.completed)
                .completionRate(CompletionMath.rate(acc.completed, acc.required))
                .status(CompletionStatus.of(acc.completed, acc.required))
                .build()));
        return models;
    }

    // -----------------------------------------------------------------------
    // Per region
    // -----------------------------------------------------------------------

    List<RegionCompletion> byRegion(List<StoreCompletion> stores) {
        Map<String, RegionAccumulator> grouped = new LinkedHashMap<>();
        for (StoreCompletion store : stores) {
            RegionAccumulator acc = grouped.computeIfAbsent(store.getRegion(), k -> new RegionAccumulator());
            acc.storeCount++;
            acc.provinces.add(store.getProvince());
            acc.totalDisplays += store.getRecords().size();
            acc.required += store.getTotalRequiredPosm();
            acc.completed += store.getCompletedPosm();
        }

        List<RegionCompletion> regions = new ArrayList<>(grouped.size());
        grouped.forEach((region, acc) -> regions.add(RegionCompletion.builder()
                .region(region)
                .storeCount(acc.storeCount)
                .provinceCount(acc.provinces.size())
                .provinces(List.copyOf(acc.provinces))
                .totalDisplays(acc.totalDisplays)
                .requiredPosm(acc.required)
                .completedPosm(acc.completed)
                .completionRate(CompletionMath.rate(acc.completed, acc.required))
                .status(CompletionStatus.of(acc.completed, acc.required))
                .build()));
        return regions;
    }

    // -----------------------------------------------------------------------
    // Per POSM type
    // -----------------------------------------------------------------------

    List<PosmTypeCompletion> byPosmType(List<CompletionRecord> records, RequirementIndex index) {
        Map<String, PosmAccumulator> grouped = new LinkedHashMap<>();
        for (CompletionRecord record : records) {
            for (String code : index.requiredCodes(record.model())) {
                PosmAccumulator acc = grouped.computeIfAbsent(code, k -> new PosmAccumulator());
                acc.requiredStores.add(record.storeId());
                if (record.confirmedPosmCodes().contains(code)) {
                    acc.completedStores.add(record.storeId());
                }
            }
        }

        List<PosmTypeCompletion> posmTypes = new ArrayList<>(grouped.size());
        grouped.forEach((code, acc) -> posmTypes.add(PosmTypeCompletion.builder()
                .posmCode(code)
                .posmName(index.posmName(code))
                .requiredStores(acc.requiredStores.size())
                .completedStores(acc.completedStores.size())
                .completionRate(CompletionMath.rate(acc.completedStores.size(), acc.requiredStores.size()))
                .build()));
        return posmTypes;
    }

    // -----------------------------------------------------------------------
    // Global overview
    // -----------------------------------------------------------------------

    GlobalCompletion overview(List<StoreCompletion> stores, List<CompletionRecord> records) {
        int required = 0;
        int completed = 0;
        Map<String, Integer> statusCounts = new LinkedHashMap<>();
        for (CompletionStatus status : CompletionStatus.values()) {
            statusCounts.put(status.getCode(), 0);
        }
        for (StoreCompletion store : stores) {
            required += store.getTotalRequiredPosm();
            completed += store.getCompletedPosm();
            statusCounts.merge(store.getStatus().getCode(), 1, Integer::sum);
        }

        long totalModels = records.stream()
                .map(record -> LabelNormalizer.normalizeModelToken(record.model()))
                .distinct()
                .count();

        return GlobalCompletion.builder()
                .totalStores(stores.size())
                .storesWithCompletePosm(statusCounts.get(CompletionStatus.COMPLETE.getCode()))
                .totalModels((int) totalModels)
                .totalRequiredPosm(required)
                .totalCompletedPosm(completed)
                .overallCompletion(CompletionMath.rate(completed, required))
                .status(CompletionStatus.of(completed, required))
                .statusCounts(statusCounts)
                .build();
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private static <T> List<T> sortedByRate(List<T> items, ToDoubleFunction<T> rate) {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingDouble(rate).reversed());
        return sorted;
    }

    private static String orUnknown(String value) {
        return isBlank(value) ? UNKNOWN : value.strip();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static final class ModelAccumulator {
        final String label;
        int totalDisplays;
        int verifiedDisplays;
        int required;
        int completed;
        final Set<String> stores = new LinkedHashSet<>();
        final Set<String> completedStores = new LinkedHashSet<>();

        ModelAccumulator(String label) {
            this.label = label;
        }
    }

    private static final class RegionAccumulator {
        int storeCount;
        int totalDisplays;
        int required;
        int completed;
        final Set<String> provinces = new LinkedHashSet<>();
    }

    private static final class PosmAccumulator {
        final Set<String> requiredStores = new LinkedHashSet<>();
        final Set<String> completedStores = new LinkedHashSet<>();
    }
}
