package com.ai.trialmatch.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Message entities merged over the intake profile; what a trial search actually uses.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public final class SearchCriteria {

    private final String cancerType;
    private final String location;
    private final Integer age;
    private final String sex;
}
