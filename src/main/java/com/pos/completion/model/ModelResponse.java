package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The part of a survey submission that covers a single product model.
 */
public record ModelResponse(

        /**
         * Free-text model name as typed or picked by the surveyor.
         */
        @JsonProperty("model")
        String model,

        @JsonProperty("posmSelections")
        List<PosmSelection> posmSelections

) {

    public ModelResponse {
        posmSelections = posmSelections == null ? List.of() : posmSelections;
    }
}
