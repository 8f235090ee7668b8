package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Introspected;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for {@code POST /api/completion/identity}: resolve one
 * submission's labels against one candidate catalog store.
 */
@Introspected
public record IdentityProbeRequest(

        @JsonProperty("leaderLabel")
        String leaderLabel,

        @JsonProperty("shopNameLabel")
        String shopNameLabel,

        @NotBlank(message = "candidateStoreId must not be blank")
        @JsonProperty("candidateStoreId")
        String candidateStoreId,

        /**
         * Store catalog used to look up the candidate's name. May be empty, in
         * which case only identifier-based methods can accept.
         */
        @JsonProperty("stores")
        List<StoreCatalogEntry> stores

) {

    public IdentityProbeRequest {
        stores = stores == null ? List.of() : stores;
    }
}
