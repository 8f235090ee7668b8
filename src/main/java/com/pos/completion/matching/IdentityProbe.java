package com.pos.completion.matching;

import com.pos.completion.model.StoreCatalogEntry;

/**
 * Normalized view of a (submission, candidate store) pair, computed once and
 * handed to every strategy in the cascade.
 *
 * @param shopName   normalized shop name label of the submission
 * @param leader     normalized leader label of the submission
 * @param storeId    normalized catalog identifier of the candidate
 * @param storeName  normalized catalog store name, {@code ""} when the candidate
 *                   is not in the catalog
 */
public record IdentityProbe(String shopName, String leader, String storeId, String storeName) {

    public static IdentityProbe of(String leaderLabel,
                                   String shopNameLabel,
                                   String candidateStoreId,
                                   StoreCatalogEntry candidate) {
        return new IdentityProbe(
                LabelNormalizer.normalizeLabel(shopNameLabel),
                LabelNormalizer.normalizeLabel(leaderLabel),
                LabelNormalizer.normalizeLabel(candidateStoreId),
                candidate == null ? "" : LabelNormalizer.normalizeLabel(candidate.storeName()));
    }
}
