package com.pos.completion.service;

import com.pos.completion.model.StoreCatalogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable store catalog lookup keyed by trimmed store id.
 *
 * Entries without a store id are skipped and counted. When the same id occurs
 * more than once, the first entry wins.
 */
public final class StoreDirectory {

    private static final Logger log = LoggerFactory.getLogger(StoreDirectory.class);

    private final Map<String, StoreCatalogEntry> entries;
    private final int skipped;

    private StoreDirectory(Map<String, StoreCatalogEntry> entries, int skipped) {
        this.entries = Collections.unmodifiableMap(entries);
        this.skipped = skipped;
    }

    public static StoreDirectory build(Collection<StoreCatalogEntry> stores) {
        Map<String, StoreCatalogEntry> entries = new LinkedHashMap<>();
        int skipped = 0;
        int duplicates = 0;
        for (StoreCatalogEntry store : stores) {
            if (store == null || store.storeId() == null || store.storeId().isBlank()) {
                skipped++;
                continue;
            }
            if (entries.putIfAbsent(store.storeId().strip(), store) != null) {
                duplicates++;
            }
        }
        if (skipped > 0 || duplicates > 0) {
            log.warn("Store catalog skippedWithoutId={} duplicateIdsIgnored={}", skipped, duplicates);
        }
        return new StoreDirectory(entries, skipped);
    }

    public StoreCatalogEntry get(String storeId) {
        return entries.get(storeId);
    }

    public Map<String, StoreCatalogEntry> entries() {
        return entries;
    }

    public int skipped() {
        return skipped;
    }
}
