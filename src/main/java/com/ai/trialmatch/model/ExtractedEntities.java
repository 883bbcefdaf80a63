package com.ai.trialmatch.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Structured fields found in a free-text message. Every field may be absent.
 */
@Getter
@Builder
@ToString
public final class ExtractedEntities {

    private static final ExtractedEntities NONE = ExtractedEntities.builder().build();

    private final String cancerType;
    private final String location;
    private final Integer age;
    private final String sex;

    public static ExtractedEntities none() {
        return NONE;
    }

    public Optional<Integer> findAge() {
        return Optional.ofNullable(age);
    }

    public boolean isEmpty() {
        return cancerType == null && location == null && age == null && sex == null;
    }
}
