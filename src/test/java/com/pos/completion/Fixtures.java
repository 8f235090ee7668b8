package com.pos.completion;

import com.pos.completion.model.DisplayAssignment;
import com.pos.completion.model.ModelResponse;
import com.pos.completion.model.PosmRequirement;
import com.pos.completion.model.PosmSelection;
import com.pos.completion.model.StoreCatalogEntry;
import com.pos.completion.model.SurveySubmission;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for test inputs.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    private Fixtures() {
    }

    public static DisplayAssignment display(String storeId, String model) {
        return new DisplayAssignment(storeId, model, true, T0);
    }

    public static StoreCatalogEntry store(String storeId, String storeName) {
        return new StoreCatalogEntry(storeId, storeName, "South", "Ho Chi Minh", "Retail");
    }

    public static StoreCatalogEntry store(String storeId, String storeName, String region, String province) {
        return new StoreCatalogEntry(storeId, storeName, region, province, "Retail");
    }

    /**
     * One requirement row per code.
     */
    public static List<PosmRequirement> requirements(String model, String... codes) {
        List<PosmRequirement> rows = new ArrayList<>();
        for (String code : codes) {
            rows.add(new PosmRequirement(model, code, code + " material"));
        }
        return rows;
    }

    /**
     * A response selecting exactly the given codes.
     */
    public static ModelResponse response(String model, String... selectedCodes) {
        List<PosmSelection> selections = new ArrayList<>();
        for (String code : selectedCodes) {
            selections.add(new PosmSelection(code, null, true));
        }
        return new ModelResponse(model, selections);
    }

    public static SurveySubmission submission(String shopName, String leader, Instant at, ModelResponse... responses) {
        return new SurveySubmission(null, leader, shopName, at, Arrays.asList(responses));
    }

    @SafeVarargs
    public static <T> List<T> concat(List<T>... lists) {
        List<T> all = new ArrayList<>();
        for (List<T> list : lists) {
            all.addAll(list);
        }
        return all;
    }
}
