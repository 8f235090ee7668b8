package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A display assignment: "this store is expected to have this model on display".
 *
 * Owned by the display catalog. The engine only reads it; at most one record
 * per (storeId, model) pair is expected, but that is the catalog's concern.
 */
public record DisplayAssignment(

        /**
         * Catalog identifier of the store that should display the model.
         */
        @JsonProperty("storeId")
        String storeId,

        /**
         * Model name as written in the display catalog.
         */
        @JsonProperty("model")
        String model,

        /**
         * Whether the display is currently active. A missing flag is treated as
         * active; only an explicit {@code false} removes the record from the run.
         */
        @JsonProperty("isDisplayed")
        Boolean displayed,

        /**
         * Last catalog modification time (informational only).
         */
        @JsonProperty("updatedAt")
        Instant updatedAt

) {

    /**
     * @return {@code true} unless the display flag is explicitly {@code false}
     */
    public boolean isActive() {
        return !Boolean.FALSE.equals(displayed);
    }
}
