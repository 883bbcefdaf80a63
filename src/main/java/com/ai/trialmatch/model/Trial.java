package com.ai.trialmatch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A recruiting study as shown to the patient.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Trial {

    private final String nctId;
    private final String title;
    private final String phase;
    private final String status;
    private final String location;
    private final String facility;
    private final String sponsor;
    private final String link;
    private final TrialContact contact;

    /** True only when the trial came from the nationwide fallback query. */
    @JsonProperty("is_nationwide")
    private final boolean nationwide;

    public Trial asNationwide(boolean nationwide) {
        return toBuilder().nationwide(nationwide).build();
    }
}
