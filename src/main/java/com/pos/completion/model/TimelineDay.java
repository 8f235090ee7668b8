package com.pos.completion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Survey activity for one calendar day, with running totals since the first day
 * of the timeline.
 */
public record TimelineDay(

        @JsonProperty("date")
        LocalDate date,

        @JsonProperty("surveys")
        int surveys,

        /** Model responses submitted that day. */
        @JsonProperty("models")
        int models,

        /** Distinct surveyed stores that day. */
        @JsonProperty("storeCount")
        int storeCount,

        @JsonProperty("cumulativeSurveys")
        int cumulativeSurveys,

        @JsonProperty("cumulativeModels")
        int cumulativeModels,

        @JsonProperty("cumulativeStores")
        int cumulativeStores

) {
}
