package com.pos.completion.service;

import com.pos.completion.matching.LabelNormalizer;
import com.pos.completion.model.PosmRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Distinct POSM codes required per model, built from the requirement catalog.
 *
 * Models are keyed by their normalized model token, so {@code "Galaxy S24"} and
 * {@code "galaxy-s24"} share one requirement set. Rows without a model or code
 * are skipped and counted.
 */
public final class RequirementIndex {

    private static final Logger log = LoggerFactory.getLogger(RequirementIndex.class);

    private final Map<String, SortedSet<String>> codesByModel;
    private final Map<String, String> posmNames;
    private final int skipped;

    private RequirementIndex(Map<String, SortedSet<String>> codesByModel, Map<String, String> posmNames, int skipped) {
        this.codesByModel = codesByModel;
        this.posmNames = posmNames;
        this.skipped = skipped;
    }

    public static RequirementIndex build(Collection<PosmRequirement> requirements) {
        Map<String, SortedSet<String>> codesByModel = new HashMap<>();
        Map<String, String> posmNames = new HashMap<>();
        int skipped = 0;

        for (PosmRequirement requirement : requirements) {
            String modelKey = requirement == null ? "" : LabelNormalizer.normalizeModelToken(requirement.model());
            if (modelKey.isEmpty() || requirement.posmCode() == null || requirement.posmCode().isBlank()) {
                skipped++;
                continue;
            }
            String code = requirement.posmCode().strip();
            codesByModel.computeIfAbsent(modelKey, k -> new TreeSet<>()).add(code);
            if (requirement.posmName() != null && !requirement.posmName().isBlank()) {
                posmNames.putIfAbsent(code, requirement.posmName().strip());
            }
        }

        if (skipped > 0) {
            log.warn("Requirement catalog skipped {} rows without model or POSM code", skipped);
        }

        Map<String, SortedSet<String>> frozen = new HashMap<>();
        codesByModel.forEach((model, codes) -> frozen.put(model, Collections.unmodifiableSortedSet(codes)));
        log.debug("Requirement index built models={} skipped={}", frozen.size(), skipped);
        return new RequirementIndex(Collections.unmodifiableMap(frozen), Collections.unmodifiableMap(posmNames), skipped);
    }

    /**
     * @return number of distinct POSM codes the model requires; 0 for unknown models
     */
    public int requiredCount(String model) {
        return requiredCodes(model).size();
    }

    public SortedSet<String> requiredCodes(String model) {
        return codesByModel.getOrDefault(LabelNormalizer.normalizeModelToken(model), Collections.emptySortedSet());
    }

    /**
     * @return the catalog name of a POSM code, or the code itself when unnamed
     */
    public String posmName(String posmCode) {
        return posmNames.getOrDefault(posmCode, posmCode);
    }

    public int skipped() {
        return skipped;
    }
}
