package com.ai.trialmatch.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of one search pipeline run.
 * {@code degraded} means the registry could not be reached, so an empty list is not a real answer.
 */
@Getter
@ToString
public final class TrialSearchResult {

    private final List<Trial> trials;
    private final boolean nationwide;
    private final boolean degraded;

    private TrialSearchResult(List<Trial> trials, boolean nationwide, boolean degraded) {
        this.trials = trials != null ? List.copyOf(trials) : List.of();
        this.nationwide = nationwide;
        this.degraded = degraded;
    }

    public static TrialSearchResult local(List<Trial> trials) {
        return new TrialSearchResult(trials, false, false);
    }

    public static TrialSearchResult nationwide(List<Trial> trials) {
        return new TrialSearchResult(trials, true, false);
    }

    public static TrialSearchResult empty() {
        return new TrialSearchResult(List.of(), false, false);
    }

    public static TrialSearchResult degraded() {
        return new TrialSearchResult(List.of(), false, true);
    }

    public boolean isEmpty() {
        return trials.isEmpty();
    }

    public int size() {
        return trials.size();
    }
}
