package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One POSM checkbox within a model response.
 */
public record PosmSelection(

        @JsonProperty("posmCode")
        String posmCode,

        @JsonProperty("posmName")
        String posmName,

        /**
         * Whether the surveyor confirmed the material is present.
         */
        @JsonProperty("selected")
        boolean selected

) {
}
