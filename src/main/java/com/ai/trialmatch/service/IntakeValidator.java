package com.ai.trialmatch.service;

import com.ai.trialmatch.dto.IntakeRequest;
import com.ai.trialmatch.exception.IntakeValidationException;
import com.ai.trialmatch.model.PatientIntake;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns an intake form into a {@link PatientIntake}, or rejects it listing every bad field.
 */
@Component
public class IntakeValidator {

    static final Set<String> ACCEPTED_SEX = Set.of("male", "female", "other");

    public PatientIntake validate(IntakeRequest request) {
        if (request == null) {
            throw new IntakeValidationException(List.of("body"), "Intake form is empty");
        }
        List<String> invalid = new ArrayList<>();
        requireText(request.getUserId(), "user_id", invalid);
        requireText(request.getCancerType(), "cancer_type", invalid);
        requireText(request.getStage(), "stage", invalid);
        requireText(request.getLocation(), "location", invalid);
        if (request.getAge() == null || request.getAge() < 0) {
            invalid.add("age");
        }
        String sex = StringUtils.trimToEmpty(request.getSex()).toLowerCase(Locale.ROOT);
        if (!ACCEPTED_SEX.contains(sex)) {
            invalid.add("sex");
        }
        if (!invalid.isEmpty()) {
            throw new IntakeValidationException(invalid, "Missing or invalid intake fields: " + String.join(", ", invalid));
        }

        return PatientIntake.builder()
                .userId(request.getUserId().trim())
                .cancerType(request.getCancerType().trim())
                .stage(request.getStage().trim())
                .age(request.getAge())
                .sex(sex)
                .location(StringUtils.normalizeSpace(request.getLocation()))
                .comorbidities(clean(request.getComorbidities()))
                .priorTreatments(clean(request.getPriorTreatments()))
                .build();
    }

    private static void requireText(String value, String field, List<String> invalid) {
        if (StringUtils.isBlank(value)) {
            invalid.add(field);
        }
    }

    private static List<String> clean(List<String> values) {
        if (values == null) return List.of();
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }
}
