package com.ai.trialmatch.service;

import com.ai.trialmatch.dto.IntakeRequest;
import com.ai.trialmatch.exception.IntakeValidationException;
import com.ai.trialmatch.model.PatientIntake;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class IntakeValidatorTest {

    private final IntakeValidator validator = new IntakeValidator();

    @Test
    public void shouldBuildIntakeFromValidForm() {
        IntakeRequest request = validRequest()
                .sex(" Female ")
                .location("  Los   Angeles, CA ")
                .comorbidities(Arrays.asList("diabetes", " ", null, " hypertension "))
                .build();

        PatientIntake intake = validator.validate(request);

        assertThat(intake.getUserId()).isEqualTo("u1");
        assertThat(intake.getSex()).isEqualTo("female");
        assertThat(intake.getLocation()).isEqualTo("Los Angeles, CA");
        assertThat(intake.getComorbidities()).containsExactly("diabetes", "hypertension");
        assertThat(intake.getPriorTreatments()).isEmpty();
    }

    @Test
    public void shouldListEveryMissingField() {
        IntakeRequest request = IntakeRequest.builder()
                .userId("u1")
                .cancerType(" ")
                .age(-1)
                .sex("unknown")
                .build();

        IntakeValidationException e = catchThrowableOfType(() -> validator.validate(request), IntakeValidationException.class);

        assertThat(e.getFields()).containsExactly("cancer_type", "stage", "location", "age", "sex");
        assertThat(e.getMessage()).contains("cancer_type");
    }

    @Test
    public void shouldRejectMissingAge() {
        IntakeRequest request = validRequest().age(null).build();

        IntakeValidationException e = catchThrowableOfType(() -> validator.validate(request), IntakeValidationException.class);

        assertThat(e.getFields()).containsExactly("age");
    }

    @Test
    public void shouldRejectEmptyBody() {
        IntakeValidationException e = catchThrowableOfType(() -> validator.validate(null), IntakeValidationException.class);

        assertThat(e.getFields()).containsExactly("body");
    }

    private static IntakeRequest.IntakeRequestBuilder validRequest() {
        return IntakeRequest.builder()
                .userId("u1")
                .cancerType("lung cancer")
                .stage("stage 2")
                .age(60)
                .sex("male")
                .location("California");
    }
}
