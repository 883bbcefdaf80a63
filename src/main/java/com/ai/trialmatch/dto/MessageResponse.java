package com.ai.trialmatch.dto;

import com.ai.trialmatch.model.Trial;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Reply to {@code POST /message}. Only {@code response} is always present; {@code trials},
 * {@code nationwide} and {@code degraded} appear for trial searches, {@code requires_intake}
 * when the intake form is still missing.
 */
@Getter
@ToString
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageResponse {

    private final String response;

    private final String intent;

    private final List<Trial> trials;

    private final Boolean nationwide;

    private final Boolean degraded;

    private final Boolean requiresIntake;
}
