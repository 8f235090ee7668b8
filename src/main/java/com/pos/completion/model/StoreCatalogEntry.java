package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical store identity, keyed by {@code storeId}.
 */
public record StoreCatalogEntry(

        @JsonProperty("storeId")
        String storeId,

        /**
         * Display name of the store; the primary needle for identity resolution.
         */
        @JsonProperty("storeName")
        String storeName,

        @JsonProperty("region")
        String region,

        @JsonProperty("province")
        String province,

        @JsonProperty("channel")
        String channel

) {
}
