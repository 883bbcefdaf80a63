package com.ai.trialmatch.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Structured patient profile submitted once before chatting.
 * A resubmission replaces the whole profile; fields are never merged.
 */
@Getter
@Builder
@ToString
public final class PatientIntake {

    private final String userId;
    private final String cancerType;
    /** Free-form, e.g. "stage 2". */
    private final String stage;
    private final int age;
    private final String sex;
    private final String location;
    @Singular
    private final List<String> comorbidities;
    @Singular
    private final List<String> priorTreatments;
}
