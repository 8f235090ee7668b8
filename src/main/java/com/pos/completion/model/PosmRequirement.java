package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * States that {@code model} requires the point-of-sale material {@code posmCode}.
 *
 * Several rows may repeat the same (model, posmCode) pair; only distinct codes
 * count towards the requirement.
 */
public record PosmRequirement(

        @JsonProperty("model")
        String model,

        @JsonProperty("posmCode")
        String posmCode,

        @JsonProperty("posmName")
        String posmName

) {
}
