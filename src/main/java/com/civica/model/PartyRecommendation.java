package com.civica.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Party recommendation with confidence and reasoning.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PartyRecommendation {

    @JsonProperty("party")
    private String partyId;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("reasoning")
    private String reasoning;
}
