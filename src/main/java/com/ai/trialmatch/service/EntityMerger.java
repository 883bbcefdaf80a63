package com.ai.trialmatch.service;

import com.ai.trialmatch.model.ExtractedEntities;
import com.ai.trialmatch.model.PatientIntake;
import com.ai.trialmatch.model.SearchCriteria;
import com.ai.trialmatch.utils.LocationNormalizer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Lays message entities over the intake profile, field by field: a value found in the message
 * wins, otherwise the intake value stays. A message naming only a new city keeps the intake's
 * cancer type.
 * <p>
 * A bare city from the message ("Los Angeles") borrows the state when the intake location is
 * itself just a state ("California"), giving "Los Angeles, CA".
 */
@Component
public class EntityMerger {

    public SearchCriteria merge(PatientIntake intake, ExtractedEntities entities) {
        ExtractedEntities found = entities != null ? entities : ExtractedEntities.none();

        String cancerType = pick(found.getCancerType(), intake.getCancerType());
        String sex = pick(found.getSex(), intake.getSex());
        Integer age = found.findAge().orElse(intake.getAge());

        String location;
        if (StringUtils.isNotBlank(found.getLocation())) {
            location = qualifyWithIntakeState(found.getLocation().trim(), intake.getLocation());
        } else {
            location = intake.getLocation();
        }

        return SearchCriteria.builder()
                .cancerType(cancerType)
                .location(LocationNormalizer.normalize(location))
                .age(age)
                .sex(sex)
                .build();
    }

    private static String pick(String extracted, String fallback) {
        return StringUtils.isNotBlank(extracted) ? extracted.trim() : fallback;
    }

    private static String qualifyWithIntakeState(String extractedLocation, String intakeLocation) {
        if (LocationNormalizer.hasState(extractedLocation)) {
            return extractedLocation;
        }
        Optional<String> intakeState = LocationNormalizer.stateCode(intakeLocation);
        return intakeState
                .map(code -> LocationNormalizer.qualify(extractedLocation, code))
                .orElse(extractedLocation);
    }
}
